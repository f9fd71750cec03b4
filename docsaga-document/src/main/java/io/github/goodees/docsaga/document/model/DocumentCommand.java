package io.github.goodees.docsaga.document.model;

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

import java.util.Objects;

/**
 * Commands accepted by the document aggregate. The set of commands is closed, all of them are nested here.
 */
public abstract class DocumentCommand {

    private DocumentCommand() {
    }

    /**
     * Create the document, or replace its title and content. Also used for restoring an older version.
     */
    public static final class CreateOrUpdate extends DocumentCommand {
        private final Document document;

        public CreateOrUpdate(Document document) {
            this.document = Objects.requireNonNull(document);
        }

        public Document getDocument() {
            return document;
        }

        @Override
        public String toString() {
            return "CreateOrUpdate{" + document + '}';
        }
    }

    public static final class SetApprovalCode extends DocumentCommand {
        private final String code;

        public SetApprovalCode(String code) {
            this.code = Objects.requireNonNull(code);
        }

        public String getCode() {
            return code;
        }

        @Override
        public String toString() {
            return "SetApprovalCode{" + code + '}';
        }
    }

    public static final class Approve extends DocumentCommand {
        @Override
        public String toString() {
            return "Approve";
        }
    }

    public static final class Reject extends DocumentCommand {
        @Override
        public String toString() {
            return "Reject";
        }
    }
}
