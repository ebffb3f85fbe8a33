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

import com.google.devtools.common.options.Option;
import com.google.devtools.common.options.OptionsBase;

/** Command-line options for the standalone stub server. */
public class StubCasOptions extends OptionsBase {
  @Option(name = "help", abbrev = 'h', help = "Prints usage info.", defaultValue = "false")
  public boolean help;

  @Option(name = "port", abbrev = 'p', help = "Port to use.", defaultValue = "-1")
  public int port;

  @Option(
      name = "chunk_size_bytes",
      help = "Maximum bytes per read response. 0 keeps the configured value.",
      defaultValue = "0")
  public int chunkSizeBytes;

  @Option(
      name = "always_fail",
      help = "Fail every read, write and missing blobs query with INTERNAL.",
      defaultValue = "false")
  public boolean alwaysFail;

  @Option(
      name = "prometheus_port",
      help = "Port for the Prometheus HTTP server. 0 disables it.",
      defaultValue = "-1")
  public int prometheusPort;
}
