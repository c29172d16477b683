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

import io.netty.util.AsciiString;
import io.netty.util.CharsetUtil;

import java.util.ArrayList;
import java.util.List;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Comparison and canonical forms of domain names given in their textual form.
 * <p>
 * Names are compared case-insensitively and without regard to a trailing dot. The ordering is the canonical DNS
 * name order of RFC 4034, section 6.1: labels are compared from the root towards the owner, each as a lower case
 * octet sequence.
 * <p>
 * Only ASCII letters are folded. Labels are turned back into octets as UTF-8, because the names come from the
 * strings Netty's record decoder produces, which has already decoded each label as UTF-8. Label octets that are
 * not valid UTF-8 were replaced by U+FFFD at that point, so two names that differ only in such octets share one
 * canonical form.
 */
public final class DnsNames {

    static final String ROOT = ".";

    /**
     * Returns the given name with a trailing dot.
     */
    public static String toAbsolute(String name) {
        checkNotNull(name, "name");
        if (name.isEmpty() || ROOT.equals(name)) {
            return ROOT;
        }
        return name.charAt(name.length() - 1) == '.' ? name : name + '.';
    }

    /**
     * Returns {@code true} if both names denote the same domain.
     */
    public static boolean equals(String a, String b) {
        return AsciiString.contentEqualsIgnoreCase(toAbsolute(a), toAbsolute(b));
    }

    /**
     * Returns a hash code consistent with {@link #equals(String, String)}.
     */
    public static int hashCode(String name) {
        return AsciiString.hashCode(toAbsolute(name));
    }

    /**
     * Compares two names in canonical DNS name order.
     */
    public static int compare(String a, String b) {
        List<byte[]> left = labels(a);
        List<byte[]> right = labels(b);
        int common = Math.min(left.size(), right.size());
        for (int i = 1; i <= common; i++) {
            int cmp = compareUnsigned(left.get(left.size() - i), right.get(right.size() - i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    /**
     * Returns the uncompressed wire format of the name with all ASCII letters in lower case.
     */
    public static byte[] toCanonicalWire(String name) {
        List<byte[]> labels = labels(name);
        int length = 1;
        for (byte[] label : labels) {
            length += label.length + 1;
        }
        byte[] wire = new byte[length];
        int index = 0;
        for (byte[] label : labels) {
            wire[index++] = (byte) label.length;
            System.arraycopy(label, 0, wire, index, label.length);
            index += label.length;
        }
        wire[index] = 0;
        return wire;
    }

    private static List<byte[]> labels(String name) {
        String absolute = toAbsolute(name);
        List<byte[]> labels = new ArrayList<byte[]>(4);
        if (ROOT.equals(absolute)) {
            return labels;
        }
        int start = 0;
        for (int i = 0; i < absolute.length(); i++) {
            if (absolute.charAt(i) == '.') {
                labels.add(lowerCase(absolute.substring(start, i).getBytes(CharsetUtil.UTF_8)));
                start = i + 1;
            }
        }
        return labels;
    }

    private static byte[] lowerCase(byte[] label) {
        for (int i = 0; i < label.length; i++) {
            byte b = label[i];
            if (b >= 'A' && b <= 'Z') {
                label[i] = (byte) (b + ('a' - 'A'));
            }
        }
        return label;
    }

    static int compareUnsigned(byte[] a, byte[] b) {
        int common = Math.min(a.length, b.length);
        for (int i = 0; i < common; i++) {
            int cmp = (a[i] & 0xFF) - (b[i] & 0xFF);
            if (cmp != 0) {
                return cmp;
            }
        }
        return a.length - b.length;
    }

    private DnsNames() {
        // Unused
    }
}
