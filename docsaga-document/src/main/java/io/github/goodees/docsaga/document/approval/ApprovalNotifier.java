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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers approval code to the approvers. Invoked once, when the saga leaves the sending phase during normal
 * operation; not invoked again when the saga recovers in that phase.
 */
@FunctionalInterface
public interface ApprovalNotifier {

    void notifyApprovers(String documentId, String approvalCode) throws Exception;

    /**
     * Notifier that only writes the notification to the log.
     * @return logging notifier
     */
    static ApprovalNotifier logging() {
        Logger logger = LoggerFactory.getLogger(ApprovalNotifier.class);
        return (documentId, code) -> logger.info("Approval code {} sent for document {}", code, documentId);
    }
}
