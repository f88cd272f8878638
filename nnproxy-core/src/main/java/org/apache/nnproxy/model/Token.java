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

import com.google.common.io.BaseEncoding;

import java.util.Arrays;
import java.util.Objects;

/**
 * A delegation or block access token. The NameNode client treats the identifier and password as opaque bytes.
 */
public class Token {
    private byte[] identifier;
    private byte[] password;
    private String kind;
    private String service;

    public Token() {
        this(new byte[0], new byte[0], "", "");
    }

    public Token(byte[] identifier, byte[] password, String kind, String service) {
        this.identifier = identifier;
        this.password = password;
        this.kind = kind;
        this.service = service;
    }

    public byte[] getIdentifier() {
        return identifier;
    }

    public byte[] getPassword() {
        return password;
    }

    public String getKind() {
        return kind;
    }

    public String getService() {
        return service;
    }

    public void setService(String service) {
        this.service = service;
    }

    // url safe base64 of identifier and password, the form tokens are passed around in
    public String toUrlString() {
        BaseEncoding encoding = BaseEncoding.base64Url().omitPadding();
        return encoding.encode(identifier) + "." + encoding.encode(password) + "." + kind + "." + service;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Token)) {
            return false;
        }
        Token other = (Token) o;
        return Arrays.equals(identifier, other.identifier) && Arrays.equals(password, other.password)
                && Objects.equals(kind, other.kind) && Objects.equals(service, other.service);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(identifier), Arrays.hashCode(password), kind, service);
    }

    @Override
    public String toString() {
        return "Kind: " + kind + ", Service: " + service;
    }
}
