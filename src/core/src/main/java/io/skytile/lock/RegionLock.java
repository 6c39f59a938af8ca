/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.skytile.lock;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Readers-writer lock over rectangular regions of one image.
 * <p>
 * Each granted request becomes an entry recording its {@link Region}, {@link LockMode}, {@link LockHolder}
 * and {@link LockToken}. A request conflicts with an entry when the two regions intersect and at least
 * one of them is {@link LockMode#WRITE}. Disjoint regions never conflict, and overlapping reads are
 * granted together.
 *
 * <h2>Blocking</h2>
 * <p>A conflicting request parks the caller until some entry is released. Every release wakes all parked
 * callers, and each re-runs the admission check from scratch. There is no queue: a request arriving
 * after a parked one may be granted first, and no waiter is guaranteed to make progress. Waiting has no
 * timeout and ignores interrupts (the interrupt status is kept for the caller to observe once granted).
 *
 * <h2>Thread Safety</h2>
 * <p>The entry list is guarded by a single {@link ReentrantLock}; the admission check and the insertion
 * of the new entry happen under it atomically. Pixel I/O done by holders is never performed under it.
 *
 * <h2>Nesting</h2>
 * <p>A holder may own at most one entry per manager. Requests from a holder that already owns an entry
 * fail with {@link RecursiveLockException} instead of risking a self-deadlock.
 *
 * <pre>{@code
 * RegionLock lock = new RegionLock();
 * LockToken token = lock.enter(Region.of(0, 0, 512, 64), LockMode.WRITE);
 * try {
 *     // read and write the pixels of the band
 * } finally {
 *     lock.exit(token);
 * }
 * }</pre>
 */
@Slf4j
public class RegionLock {

    /**
     * How the mode of a granted entry is recorded.
     */
    public enum Policy {
        /** Entries keep the requested mode: the symmetric readers-writer rule. */
        SYMMETRIC,
        /**
         * Every entry is recorded as {@link LockMode#READ} whatever was requested. A later read is then
         * never blocked by an existing write, while a later write still waits on any overlapping entry.
         * Matches the historical behavior of the pipeline this library serves.
         */
        LEGACY_READ_RECORDING
    }

    private record Entry(Region region, LockMode mode, LockHolder holder, LockToken token) {}

    private final ReentrantLock guard = new ReentrantLock();
    private final Condition released = guard.newCondition();

    /** Kept as a list: an image rarely has more entries than worker threads. */
    private final List<Entry> entries = new ArrayList<>();

    private final Policy policy;
    private int waiting;

    /**
     * Creates a lock manager with the {@link Policy#SYMMETRIC} policy.
     */
    public RegionLock() {
        this(Policy.SYMMETRIC);
    }

    /**
     * @param policy how granted modes are recorded
     */
    public RegionLock(Policy policy) {
        this.policy = requireNonNull(policy, "policy");
    }

    /**
     * @return the recording policy of this manager
     */
    public Policy policy() {
        return policy;
    }

    /**
     * Same as {@link #enter(LockHolder, Region, LockMode)} with the calling thread as holder.
     *
     * @param region the region to claim
     * @param mode the requested access
     * @return the token of the new entry
     */
    public LockToken enter(Region region, LockMode mode) {
        return enter(LockHolder.currentThread(), region, mode);
    }

    /**
     * Claims {@code region} for {@code holder}, blocking while a conflicting entry exists.
     *
     * @param holder who will own the entry
     * @param region the region to claim
     * @param mode the requested access
     * @return the token of the new entry
     * @throws RecursiveLockException if {@code holder} already owns an entry on this manager
     */
    public LockToken enter(LockHolder holder, Region region, LockMode mode) {
        requireNonNull(holder, "holder");
        requireNonNull(region, "region");
        requireNonNull(mode, "mode");

        guard.lock();
        try {
            while (true) {
                boolean conflict = false;
                for (Entry entry : entries) {
                    if (entry.holder().equals(holder)) {
                        throw new RecursiveLockException(
                                "Attempted to acquire an area lock when another area lock is already held by "
                                        + holder);
                    }
                    conflict |= conflicts(entry, region, mode);
                }
                if (!conflict) {
                    LockToken token = LockToken.next();
                    LockMode recorded = policy == Policy.LEGACY_READ_RECORDING ? LockMode.READ : mode;
                    entries.add(new Entry(region, recorded, holder, token));
                    log.debug("Granted {} lock on {} to {} ({})", mode, region, holder, token);
                    return token;
                }
                log.trace("{} waits for {} lock on {}", holder, mode, region);
                waiting++;
                try {
                    released.awaitUninterruptibly();
                } finally {
                    waiting--;
                }
            }
        } finally {
            guard.unlock();
        }
    }

    /**
     * Same as {@link #exit(LockHolder, LockToken)} with the calling thread as releaser.
     *
     * @param token the token of the entry to release
     */
    public void exit(LockToken token) {
        exit(LockHolder.currentThread(), token);
    }

    /**
     * Releases the entry identified by {@code token} and wakes every waiting caller.
     *
     * @param releaser who is releasing; must be the entry's holder
     * @param token the token of the entry to release
     * @throws UnknownLockTokenException if no live entry has that token
     * @throws NotLockOwnerException if {@code releaser} is not the entry's holder; the entry stays in place
     */
    public void exit(LockHolder releaser, LockToken token) {
        release(releaser, token, false);
    }

    /**
     * Same as {@link #forceExit(LockHolder, LockToken)} with the calling thread as releaser.
     *
     * @param token the token of the entry to release
     */
    public void forceExit(LockToken token) {
        forceExit(LockHolder.currentThread(), token);
    }

    /**
     * Releases an entry whoever holds it. Meant for recovering the locks of a worker that died or was
     * abandoned; releasing a foreign entry is logged as a warning.
     *
     * @param releaser who is releasing
     * @param token the token of the entry to release
     * @throws UnknownLockTokenException if no live entry has that token
     */
    public void forceExit(LockHolder releaser, LockToken token) {
        release(releaser, token, true);
    }

    private void release(LockHolder releaser, LockToken token, boolean force) {
        requireNonNull(releaser, "releaser");
        requireNonNull(token, "token");

        guard.lock();
        try {
            Iterator<Entry> it = entries.iterator();
            while (it.hasNext()) {
                Entry entry = it.next();
                if (!entry.token().equals(token)) {
                    continue;
                }
                if (!entry.holder().equals(releaser)) {
                    if (!force) {
                        throw new NotLockOwnerException("Tried to exit a lock held by " + entry.holder()
                                + " from " + releaser);
                    }
                    log.warn("Exited a lock on {} held by {} from {}", entry.region(), entry.holder(), releaser);
                }
                it.remove();
                log.debug("Released lock on {} held by {} ({})", entry.region(), entry.holder(), token);
                released.signalAll();
                return;
            }
        } finally {
            guard.unlock();
        }
        throw new UnknownLockTokenException("No lock held for " + token);
    }

    /**
     * @return the number of live entries
     */
    public int activeLocks() {
        guard.lock();
        try {
            return entries.size();
        } finally {
            guard.unlock();
        }
    }

    /**
     * @return the number of callers currently parked in {@link #enter(LockHolder, Region, LockMode)}
     */
    public int waitingCount() {
        guard.lock();
        try {
            return waiting;
        } finally {
            guard.unlock();
        }
    }

    /**
     * @param holder a holder
     * @return {@code true} if {@code holder} owns a live entry on this manager
     */
    public boolean isHeldBy(LockHolder holder) {
        guard.lock();
        try {
            return entries.stream().anyMatch(e -> e.holder().equals(holder));
        } finally {
            guard.unlock();
        }
    }

    private static boolean conflicts(Entry entry, Region region, LockMode mode) {
        return region.intersects(entry.region()) && (entry.mode() == LockMode.WRITE || mode == LockMode.WRITE);
    }

    @Override
    public String toString() {
        return "RegionLock[policy=%s, active=%d, waiting=%d]".formatted(policy, activeLocks(), waitingCount());
    }
}
