package dev.xcdl.queue;

/** Result of an enqueue command. The job id is only set for {@link Outcome#QUEUED}. */
public record EnqueueResult(Outcome outcome, String itemId, String jobId) {

	public enum Outcome {
		QUEUED,
		ALREADY_QUEUED,
		ALREADY_DOWNLOADED
	}

	public static EnqueueResult queued(String itemId, String jobId) {
		return new EnqueueResult(Outcome.QUEUED, itemId, jobId);
	}

	public static EnqueueResult alreadyQueued(String itemId) {
		return new EnqueueResult(Outcome.ALREADY_QUEUED, itemId, null);
	}

	public static EnqueueResult alreadyDownloaded(String itemId) {
		return new EnqueueResult(Outcome.ALREADY_DOWNLOADED, itemId, null);
	}

	public boolean isQueued() {
		return outcome == Outcome.QUEUED;
	}
}
