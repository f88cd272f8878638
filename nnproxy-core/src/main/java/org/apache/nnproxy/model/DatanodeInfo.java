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

import java.util.Objects;

public class DatanodeInfo {
    private String ipAddr;
    private String hostName;
    private String datanodeId;
    private int xferPort;
    private int infoPort;
    private int ipcPort;
    private String location = "/default-rack";

    public DatanodeInfo(String ipAddr, String hostName, String datanodeId, int xferPort, int infoPort, int ipcPort) {
        this.ipAddr = ipAddr;
        this.hostName = hostName;
        this.datanodeId = datanodeId;
        this.xferPort = xferPort;
        this.infoPort = infoPort;
        this.ipcPort = ipcPort;
    }

    public String getIpAddr() {
        return ipAddr;
    }

    public String getHostName() {
        return hostName;
    }

    public String getDatanodeId() {
        return datanodeId;
    }

    public int getXferPort() {
        return xferPort;
    }

    public int getInfoPort() {
        return infoPort;
    }

    public int getIpcPort() {
        return ipcPort;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String formatAddress() {
        return hostName + "(" + ipAddr + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DatanodeInfo)) {
            return false;
        }
        DatanodeInfo other = (DatanodeInfo) o;
        return xferPort == other.xferPort && Objects.equals(ipAddr, other.ipAddr)
                && Objects.equals(datanodeId, other.datanodeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ipAddr, datanodeId, xferPort);
    }

    @Override
    public String toString() {
        return ipAddr + ":" + xferPort;
    }
}
