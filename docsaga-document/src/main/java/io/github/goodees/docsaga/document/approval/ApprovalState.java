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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * Phases of document approval. Persisted in the saga journal as JSON with the phase name in property
 * {@code phase}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "phase")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ApprovalState.GeneratingCode.class, name = "GeneratingCode"),
        @JsonSubTypes.Type(value = ApprovalState.SendingNotification.class, name = "SendingNotification"),
        @JsonSubTypes.Type(value = ApprovalState.WaitingForApproval.class, name = "WaitingForApproval"),
        @JsonSubTypes.Type(value = ApprovalState.Approved.class, name = "Approved"),
        @JsonSubTypes.Type(value = ApprovalState.Rejected.class, name = "Rejected") })
public abstract class ApprovalState {

    private ApprovalState() {
    }

    /**
     * Whether the phase ends the workflow.
     * @return true for approved and rejected
     */
    @JsonIgnore
    public boolean isTerminal() {
        return false;
    }

    @Override
    public boolean equals(Object o) {
        return o != null && o.getClass() == getClass();
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

    public static GeneratingCode generatingCode() {
        return new GeneratingCode();
    }

    public static SendingNotification sendingNotification(String code) {
        return new SendingNotification(code);
    }

    public static WaitingForApproval waitingForApproval(String code) {
        return new WaitingForApproval(code);
    }

    public static Approved approved() {
        return new Approved();
    }

    public static Rejected rejected() {
        return new Rejected();
    }

    public static final class GeneratingCode extends ApprovalState {
    }

    /**
     * Base of phases that know the approval code.
     */
    abstract static class WithCode extends ApprovalState {
        private final String code;

        WithCode(String code) {
            this.code = Objects.requireNonNull(code, "code");
        }

        public String getCode() {
            return code;
        }

        @Override
        public boolean equals(Object o) {
            return super.equals(o) && code.equals(((WithCode) o).code);
        }

        @Override
        public int hashCode() {
            return 31 * super.hashCode() + code.hashCode();
        }

        @Override
        public String toString() {
            return super.toString() + "{" + code + '}';
        }
    }

    public static final class SendingNotification extends WithCode {
        @JsonCreator
        SendingNotification(@JsonProperty("code") String code) {
            super(code);
        }
    }

    public static final class WaitingForApproval extends WithCode {
        @JsonCreator
        WaitingForApproval(@JsonProperty("code") String code) {
            super(code);
        }
    }

    public static final class Approved extends ApprovalState {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    public static final class Rejected extends ApprovalState {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
