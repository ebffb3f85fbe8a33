// Copyright 2026 The Buildfarm Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package build.stubcas.common.config;

import lombok.Data;

@Data
public class Server {
  private String name = "stubcas";
  private String bindAddress = "";
  private int port = 8980;

  /** Bytes per read response. Negative puts the server in always fail mode. */
  private long chunkSizeBytes = 1024;

  private int maxInboundMessageSizeBytes = 0;
}
