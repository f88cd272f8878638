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

import com.google.common.base.Preconditions;

/**
 * Whether calls may fail over to another NameNode, and how many times.
 * HA is enabled only when more than one NameNode is configured.
 */
public class HaConfig {
    private final boolean enabled;
    private final int maxRetry;

    private HaConfig(boolean enabled, int maxRetry) {
        this.enabled = enabled;
        this.maxRetry = maxRetry;
    }

    public static HaConfig of(int namenodeNum, int configuredMaxRetry) {
        if (namenodeNum > 1) {
            Preconditions.checkArgument(configuredMaxRetry >= 0,
                    "max ha retry must not be negative: %s", configuredMaxRetry);
            return new HaConfig(true, configuredMaxRetry);
        }
        return new HaConfig(false, 0);
    }

    public boolean isEnabled() {
        return enabled;
    }

    // retries allowed after the first attempt of a call
    public int getMaxRetry() {
        return maxRetry;
    }

    @Override
    public String toString() {
        return "HaConfig{enabled=" + enabled + ", maxRetry=" + maxRetry + "}";
    }
}
