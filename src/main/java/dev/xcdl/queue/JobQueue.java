package dev.xcdl.queue;

import dev.xcdl.model.Job;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * FIFO of pending jobs plus the set of item ids currently queued, so that no item is ever queued
 * twice. The membership set always changes together with the list.
 */
public class JobQueue {
	private final LinkedList<Job> jobs = new LinkedList<>();
	private final Set<String> queuedItems = new HashSet<>();

	/**
	 * Append a job.
	 *
	 * @return The job id
	 * @throws DuplicateJobException if a job for the same item is already queued
	 */
	public synchronized String enqueue(Job job) {
		if (!queuedItems.add(job.itemId())) {
			throw new DuplicateJobException(job.itemId());
		}
		jobs.addLast(job);
		return job.id();
	}

	/**
	 * Remove and return the head of the queue. Its item becomes eligible for enqueueing again right
	 * away.
	 *
	 * @throws NoSuchElementException if the queue is empty
	 */
	public synchronized Job dequeueFront() {
		if (jobs.isEmpty()) {
			throw new NoSuchElementException("Job queue is empty");
		}
		Job job = jobs.removeFirst();
		queuedItems.remove(job.itemId());
		return job;
	}

	/**
	 * Remove a job wherever it is in the queue.
	 *
	 * @throws JobNotFoundException if no queued job has that id
	 */
	public synchronized Job remove(String jobId) {
		Iterator<Job> it = jobs.iterator();
		while (it.hasNext()) {
			Job job = it.next();
			if (job.id().equals(jobId)) {
				it.remove();
				queuedItems.remove(job.itemId());
				return job;
			}
		}
		throw new JobNotFoundException(jobId);
	}

	/**
	 * Reorder the queue: the named jobs come first in the given order, followed by all other jobs in
	 * their previous relative order. Unknown and repeated ids are ignored.
	 */
	public synchronized void reorder(List<String> newIdOrder) {
		Map<String, Job> remaining = new LinkedHashMap<>();
		for (Job job : jobs) {
			remaining.put(job.id(), job);
		}
		List<Job> reordered = new ArrayList<>(jobs.size());
		for (String id : newIdOrder) {
			Job job = remaining.remove(id);
			if (job != null) {
				reordered.add(job);
			}
		}
		reordered.addAll(remaining.values());
		jobs.clear();
		jobs.addAll(reordered);
	}

	/**
	 * Drop all queued jobs. A job already handed to the worker is not affected.
	 *
	 * @return Number of jobs dropped
	 */
	public synchronized int clear() {
		int dropped = jobs.size();
		jobs.clear();
		queuedItems.clear();
		return dropped;
	}

	public synchronized List<Job> list() {
		return List.copyOf(jobs);
	}

	public synchronized int size() {
		return jobs.size();
	}

	public synchronized boolean isEmpty() {
		return jobs.isEmpty();
	}

	public synchronized boolean contains(String itemId) {
		return queuedItems.contains(itemId);
	}
}
