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

package org.apache.nnproxy.common;

/**
 * Terminal error of a call that could not be placed on an active NameNode.
 * <p>
 * The cause is the failure seen on the last attempt: the {@link StandbyException} itself, or the
 * channel failure nested in a {@link FailoverException}.
 */
public class RpcException extends HdfsException {
    private static final long serialVersionUID = 5120718447382059234L;

    private final int attempts;

    public RpcException(String msg, int attempts, Throwable cause) {
        super(msg, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
