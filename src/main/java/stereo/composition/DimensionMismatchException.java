package stereo.composition;

/**
 * The two views handed to the compositor differ in size. Views are never
 * resized here; aligning them is the caller's job.
 */
public class DimensionMismatchException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public DimensionMismatchException(int leftWidth, int leftHeight, int rightWidth, int rightHeight) {
		super("left view is " + leftWidth + "x" + leftHeight + ", right view is " + rightWidth + "x" + rightHeight);
	}
}
