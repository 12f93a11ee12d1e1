package stereo.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class BatchReport {
	private final List<PairOutcome> outcomes;
	private final boolean cancelled;

	public BatchReport(List<PairOutcome> outcomes, boolean cancelled) {
		this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
		this.cancelled = cancelled;
	}

	public List<PairOutcome> getOutcomes() {
		return outcomes;
	}

	public List<PairOutcome> getSkipped() {
		List<PairOutcome> skipped = new ArrayList<>();
		for (PairOutcome outcome : outcomes) {
			if (outcome.isSkipped()) {
				skipped.add(outcome);
			}
		}
		return skipped;
	}

	public int getDoneCount() {
		return outcomes.size() - getSkipped().size();
	}

	public boolean isCancelled() {
		return cancelled;
	}

	@Override
	public String toString() {
		return getDoneCount() + " done, " + getSkipped().size() + " skipped" + (cancelled ? ", cancelled" : "");
	}
}
