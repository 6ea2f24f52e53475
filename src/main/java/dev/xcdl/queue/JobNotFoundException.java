package dev.xcdl.queue;

/** Thrown when a job id does not name a queued job */
public class JobNotFoundException extends RuntimeException {
	public JobNotFoundException(String jobId) {
		super("No queued job with id " + jobId);
	}
}
