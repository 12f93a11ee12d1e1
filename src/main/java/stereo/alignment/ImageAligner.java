package stereo.alignment;

import stereo.image.DecodeException;
import stereo.image.ImageRecord;

/**
 * Brings the right view of a pair onto the pixel grid of the left view.
 */
public interface ImageAligner {

	AlignmentResult align(ImageRecord left, ImageRecord right) throws DecodeException, AlignmentException;
}
