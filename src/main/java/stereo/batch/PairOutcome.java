package stereo.batch;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import stereo.pairing.Pair;

/**
 * What happened to one item of a batch: the files it produced, or why it was
 * skipped.
 */
public final class PairOutcome {
	public enum Status {
		DONE, SKIPPED
	}

	private final String label;
	private final Pair pair;
	private final Status status;
	private final String reason;
	private final List<Path> outputs;

	private PairOutcome(String label, Pair pair, Status status, String reason, List<Path> outputs) {
		this.label = label;
		this.pair = pair;
		this.status = status;
		this.reason = reason;
		this.outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
	}

	public static PairOutcome done(Pair pair, List<Path> outputs) {
		return new PairOutcome(pair.toString(), pair, Status.DONE, null, outputs);
	}

	/**
	 * @param outputs files already written for the pair before it failed
	 */
	public static PairOutcome skipped(Pair pair, String reason, List<Path> outputs) {
		return new PairOutcome(pair.toString(), pair, Status.SKIPPED, reason, outputs);
	}

	/**
	 * outcome of an item that is not a pair of files, e.g. an MPO file
	 */
	public static PairOutcome done(String label, List<Path> outputs) {
		return new PairOutcome(label, null, Status.DONE, null, outputs);
	}

	public static PairOutcome skipped(String label, String reason, List<Path> outputs) {
		return new PairOutcome(label, null, Status.SKIPPED, reason, outputs);
	}

	public String getLabel() {
		return label;
	}

	/**
	 * @return the pair, or null for MPO input
	 */
	public Pair getPair() {
		return pair;
	}

	public Status getStatus() {
		return status;
	}

	public boolean isSkipped() {
		return status == Status.SKIPPED;
	}

	public String getReason() {
		return reason;
	}

	public List<Path> getOutputs() {
		return outputs;
	}

	@Override
	public String toString() {
		return status == Status.DONE ? label + ": " + outputs.size() + " file(s)" : label + ": skipped, " + reason
				+ (outputs.isEmpty() ? "" : " (" + outputs.size() + " file(s) written before)");
	}
}
