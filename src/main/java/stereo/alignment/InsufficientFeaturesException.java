package stereo.alignment;

public class InsufficientFeaturesException extends AlignmentException {

	private static final long serialVersionUID = 1L;

	private final int found;
	private final int required;

	public InsufficientFeaturesException(String which, int found, int required) {
		super(which + " image has " + found + " features, at least " + required + " required");
		this.found = found;
		this.required = required;
	}

	public int getFound() {
		return found;
	}

	public int getRequired() {
		return required;
	}
}
