// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.apache.nnproxy.model;

/**
 * POSIX style permission of a file or directory, user/group/other plus the sticky bit.
 */
public class Permission {
    private static final String[] ACTIONS = {"---", "--x", "-w-", "-wx", "r--", "r-x", "rw-", "rwx"};

    private final short mode;

    public Permission(short mode) {
        this.mode = (short) (mode & 01777);
    }

    public Permission(int mode) {
        this((short) mode);
    }

    public short toShort() {
        return mode;
    }

    public int getUserAction() {
        return (mode >> 6) & 7;
    }

    public int getGroupAction() {
        return (mode >> 3) & 7;
    }

    public int getOtherAction() {
        return mode & 7;
    }

    public boolean getStickyBit() {
        return (mode & 01000) != 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Permission)) {
            return false;
        }
        return mode == ((Permission) o).mode;
    }

    @Override
    public int hashCode() {
        return mode;
    }

    @Override
    public String toString() {
        String other = ACTIONS[getOtherAction()];
        if (getStickyBit()) {
            other = other.substring(0, 2) + (other.charAt(2) == 'x' ? 't' : 'T');
        }
        return ACTIONS[getUserAction()] + ACTIONS[getGroupAction()] + other;
    }
}
