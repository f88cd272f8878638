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

package org.apache.nnproxy.ha;

import org.apache.nnproxy.common.FailoverException;
import org.apache.nnproxy.common.StandbyException;

/**
 * How a failed NameNode call relates to placement.
 */
public enum FailureKind {
    STANDBY, // the NameNode answered that it is not active, fail over at once
    FAILOVER, // the channel broke, the NameNode may be down or in transition
    OTHER; // an error of the operation itself, never retried

    public static FailureKind of(Throwable t) {
        if (t instanceof StandbyException) {
            return STANDBY;
        }
        if (t instanceof FailoverException) {
            return FAILOVER;
        }
        return OTHER;
    }

    public boolean isRetriable() {
        return this != OTHER;
    }
}
