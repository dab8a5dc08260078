/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.effectlog.sinks;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Ownership bookkeeping shared by the destination implementations.
 *
 * @since 4.0.0
 */
abstract class AbstractTextDestination implements TextDestination {

    static final int DEFAULT_COLUMNS = 80;

    private final AtomicReference<Object> owner = new AtomicReference<>();

    @Override
    public void claim(Object newOwner) {
        if (!owner.compareAndSet(null, newOwner)) {
            throw new IllegalStateException(this + " is already owned by " + owner.get());
        }
    }

    @Override
    public void release(Object currentOwner) {
        owner.compareAndSet(currentOwner, null);
    }

    @Override
    public Object getOwner() {
        return owner.get();
    }
}
