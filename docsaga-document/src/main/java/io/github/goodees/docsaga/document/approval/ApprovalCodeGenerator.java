package io.github.goodees.docsaga.document.approval;

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

import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of approval codes.
 */
@FunctionalInterface
public interface ApprovalCodeGenerator {
    int MIN_CODE = 100_000;
    int MAX_CODE = 999_999;

    String generate();

    /**
     * Six digit codes drawn uniformly from [{@value #MIN_CODE}, {@value #MAX_CODE}].
     * @return the generator
     */
    static ApprovalCodeGenerator random() {
        return () -> String.valueOf(ThreadLocalRandom.current().nextInt(MIN_CODE, MAX_CODE + 1));
    }
}
