package stereo.alignment;

/**
 * The right view of a pair could not be mapped onto the left one: too few
 * correspondences, or no usable homography.
 */
public class AlignmentException extends Exception {

	private static final long serialVersionUID = 1L;

	public AlignmentException(String message) {
		super(message);
	}
}
