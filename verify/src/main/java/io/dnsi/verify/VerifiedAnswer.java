/*
 * Copyright 2026 The Netty Project
 *
 * The Netty Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.dnsi.verify;

import io.dnsi.client.Answer;
import io.netty.util.AbstractReferenceCounted;
import io.netty.util.ReferenceCountUtil;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * An answer together with the outcome of its verification against the authoritative name servers.
 * <p>
 * A verified answer is in one of three states: verification was not requested, it failed (see
 * {@link #verificationCause()}), or it succeeded and {@link #diff()} holds the comparison. Releasing this object
 * releases both answers it holds.
 */
public final class VerifiedAnswer extends AbstractReferenceCounted {

    private final Answer answer;
    private final Answer authoritativeAnswer;
    private final AnswerDiff.Result diff;
    private final Throwable verificationCause;

    private VerifiedAnswer(Answer answer, Answer authoritativeAnswer, AnswerDiff.Result diff,
                           Throwable verificationCause) {
        this.answer = checkNotNull(answer, "answer");
        this.authoritativeAnswer = authoritativeAnswer;
        this.diff = diff;
        this.verificationCause = verificationCause;
    }

    static VerifiedAnswer unverified(Answer answer) {
        return new VerifiedAnswer(answer, null, null, null);
    }

    static VerifiedAnswer failed(Answer answer, Throwable cause) {
        return new VerifiedAnswer(answer, null, null, checkNotNull(cause, "cause"));
    }

    static VerifiedAnswer verified(Answer answer, Answer authoritativeAnswer, AnswerDiff.Result diff) {
        return new VerifiedAnswer(answer, checkNotNull(authoritativeAnswer, "authoritativeAnswer"),
                                  checkNotNull(diff, "diff"), null);
    }

    /**
     * Returns the answer of the servers the request was sent to.
     */
    public Answer answer() {
        return answer;
    }

    /**
     * Returns the answer of the authoritative servers, or {@code null} if none was obtained.
     */
    public Answer authoritativeAnswer() {
        return authoritativeAnswer;
    }

    /**
     * Returns the comparison of the authoritative answer (left) with {@link #answer()} (right), or {@code null}
     * if no verification took place.
     */
    public AnswerDiff.Result diff() {
        return diff;
    }

    /**
     * Returns why the verification failed, or {@code null}.
     */
    public Throwable verificationCause() {
        return verificationCause;
    }

    public boolean isVerified() {
        return diff != null;
    }

    @Override
    public VerifiedAnswer retain() {
        super.retain();
        return this;
    }

    @Override
    public VerifiedAnswer retain(int increment) {
        super.retain(increment);
        return this;
    }

    @Override
    public VerifiedAnswer touch() {
        super.touch();
        return this;
    }

    @Override
    public VerifiedAnswer touch(Object hint) {
        answer.touch(hint);
        if (authoritativeAnswer != null) {
            authoritativeAnswer.touch(hint);
        }
        return this;
    }

    @Override
    protected void deallocate() {
        ReferenceCountUtil.safeRelease(answer);
        if (authoritativeAnswer != null) {
            ReferenceCountUtil.safeRelease(authoritativeAnswer);
        }
    }

    @Override
    public String toString() {
        return "VerifiedAnswer(" + answer + ", verified: " + isVerified() +
               (verificationCause != null ? ", cause: " + verificationCause : "") + ')';
    }
}
