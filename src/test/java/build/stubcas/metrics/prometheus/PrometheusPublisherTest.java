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

package build.stubcas.metrics.prometheus;

import static com.google.common.truth.Truth.assertThat;

import java.io.InputStream;
import java.net.ServerSocket;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PrometheusPublisherTest {
  @After
  public void tearDown() {
    PrometheusPublisher.stopHttpServer();
  }

  @Test
  public void unconfiguredPortDoesNotStart() {
    assertThat(PrometheusPublisher.startHttpServer(null, 0)).isFalse();
    assertThat(PrometheusPublisher.startHttpServer("", -1)).isFalse();
  }

  @Test
  public void servesDefaultRegistry() throws Exception {
    int port;
    try (ServerSocket socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }

    assertThat(PrometheusPublisher.startHttpServer("localhost", port)).isTrue();

    String metrics;
    try (InputStream in = new URL("http://localhost:" + port + "/metrics").openStream()) {
      metrics = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
    assertThat(metrics).contains("jvm_");
  }
}
