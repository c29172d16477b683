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

/**
 * How a record of one answer relates to the other answer it is compared with.
 */
public enum DiffAction {
    /**
     * The record is only in the right answer.
     */
    ADDED("+ "),
    /**
     * The record is only in the left answer.
     */
    REMOVED("- "),
    /**
     * The record is in both answers.
     */
    UNCHANGED("  ");

    private final String prefix;

    DiffAction(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Returns the two characters a line of a rendered diff starts with.
     */
    public String prefix() {
        return prefix;
    }
}
