package io.github.goodees.docsaga.core.aggregate;

/*-
 * #%L
 * ese
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.docsaga.core.Event;
import io.github.goodees.docsaga.core.EventHeader;

/**
 * Counter that never drops below zero.
 */
public class CounterAggregate implements Aggregate<Integer, CounterAggregate.CounterCommand,
        CounterAggregate.CounterEvent> {

    public static final String NAME = "Counter";

    public interface CounterCommand {
    }

    public static class Add implements CounterCommand {
        final int amount;

        public Add(int amount) {
            this.amount = amount;
        }

        @Override
        public String toString() {
            return "Add(" + amount + ")";
        }
    }

    public static class Subtract implements CounterCommand {
        final int amount;

        public Subtract(int amount) {
            this.amount = amount;
        }

        @Override
        public String toString() {
            return "Subtract(" + amount + ")";
        }
    }

    public static class Noop implements CounterCommand {
    }

    public abstract static class CounterEvent extends EventHeader {
        CounterEvent(Event header) {
            super(header);
        }
    }

    public static class Changed extends CounterEvent {
        final int delta;

        Changed(Event header, int delta) {
            super(header);
            this.delta = delta;
        }

        public int getDelta() {
            return delta;
        }
    }

    public static class Refused extends CounterEvent {
        Refused(Event header) {
            super(header);
        }
    }

    @Override
    public Integer initialState() {
        return 0;
    }

    @Override
    public Decision<CounterEvent> decide(CounterCommand command, Integer state) {
        if (command instanceof Add) {
            int amount = ((Add) command).amount;
            return Decision.persist(h -> new Changed(h, amount));
        } else if (command instanceof Subtract) {
            int amount = ((Subtract) command).amount;
            if (amount > state) {
                return Decision.reject(Refused::new);
            }
            return Decision.persist(h -> new Changed(h, -amount));
        }
        return Decision.ignore();
    }

    @Override
    public Integer apply(CounterEvent event, Integer state) {
        return event instanceof Changed ? state + ((Changed) event).delta : state;
    }
}
