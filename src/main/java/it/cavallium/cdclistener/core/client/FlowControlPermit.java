package it.cavallium.cdclistener.core.client;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Binary permit gating fetch requests: the sender takes it before every request, the consumer gives it back once
 * the requested events have all been delivered. The permit count is always 0 or 1, releasing an available permit
 * does nothing.
 */
public final class FlowControlPermit {

	private final ReentrantLock lock = new ReentrantLock();
	private final Condition releasedCondition = lock.newCondition();
	private boolean available = true;

	public void acquire() throws InterruptedException {
		lock.lockInterruptibly();
		try {
			while (!available) {
				releasedCondition.await();
			}
			available = false;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @return true if the permit was taken and is now available again
	 */
	public boolean release() {
		lock.lock();
		try {
			if (available) {
				return false;
			}
			available = true;
			releasedCondition.signal();
			return true;
		} finally {
			lock.unlock();
		}
	}

	public int availablePermits() {
		lock.lock();
		try {
			return available ? 1 : 0;
		} finally {
			lock.unlock();
		}
	}
}
