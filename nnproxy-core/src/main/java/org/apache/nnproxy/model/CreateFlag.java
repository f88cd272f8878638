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

// flags of create(), combined into one int
public enum CreateFlag {
    CREATE(0x01),
    OVERWRITE(0x02),
    APPEND(0x04),
    SYNC_BLOCK(0x08);

    private final int value;

    CreateFlag(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public boolean isSet(int flag) {
        return (flag & value) != 0;
    }

    public static int combine(CreateFlag... flags) {
        int flag = 0;
        for (CreateFlag f : flags) {
            flag |= f.value;
        }
        return flag;
    }
}
