package stereo.batch;

@FunctionalInterface
public interface ProgressListener {
	/**
	 * called on the worker thread after each item of a batch
	 */
	void progress(int done, int total);
}
