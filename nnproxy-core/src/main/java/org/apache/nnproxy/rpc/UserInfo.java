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

package org.apache.nnproxy.rpc;

import org.apache.nnproxy.model.Token;

import com.google.common.base.Strings;
import com.google.common.collect.Maps;

import java.util.Map;

/**
 * The user a session acts as, with the delegation tokens it holds keyed by token service.
 */
public class UserInfo {
    private final String effectiveUser;
    private final String realUser;
    private final Map<String, Token> tokens = Maps.newConcurrentMap();

    public UserInfo(String effectiveUser) {
        this(effectiveUser, "");
    }

    public UserInfo(String effectiveUser, String realUser) {
        this.effectiveUser = effectiveUser;
        this.realUser = Strings.nullToEmpty(realUser);
    }

    public String getEffectiveUser() {
        return effectiveUser;
    }

    public String getRealUser() {
        return realUser;
    }

    // the principal the connection authenticates as
    public String getPrincipal() {
        return realUser.isEmpty() ? effectiveUser : realUser;
    }

    public void addToken(Token token) {
        tokens.put(token.getService(), token);
    }

    public Token selectToken(String service) {
        return tokens.get(service);
    }

    @Override
    public String toString() {
        return realUser.isEmpty() ? effectiveUser : effectiveUser + " via " + realUser;
    }
}
