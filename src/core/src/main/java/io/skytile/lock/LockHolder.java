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

/**
 * Identity of whoever holds a {@link RegionLock} entry.
 * <p>
 * Ownership is checked by comparing holders with {@link #equals(Object)}, which delegates to the
 * identity object. Callers that run on a task pool, where one logical worker can hop between
 * threads, should create one holder per worker with {@link #of(Object)} and pass it explicitly
 * instead of relying on {@link #currentThread()}.
 *
 * @param identity the object identifying the holder
 */
public record LockHolder(Object identity) {

    /**
     * @param identity the object identifying the holder, not null
     */
    public LockHolder {
        requireNonNull(identity, "identity");
    }

    /**
     * @param identity the object identifying the holder
     * @return a holder for that identity
     */
    public static LockHolder of(Object identity) {
        return new LockHolder(identity);
    }

    /**
     * @return a holder identified by the calling thread
     */
    public static LockHolder currentThread() {
        return new LockHolder(Thread.currentThread());
    }

    @Override
    public String toString() {
        if (identity instanceof Thread t) {
            return "LockHolder[thread=" + t.getName() + "]";
        }
        return "LockHolder[" + identity + "]";
    }
}
