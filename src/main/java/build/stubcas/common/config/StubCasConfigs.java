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

import build.stubcas.common.DigestUtil;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.HashCode;
import com.google.devtools.common.options.OptionsParser;
import com.google.devtools.common.options.OptionsParsingException;
import com.google.protobuf.ByteString;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import javax.naming.ConfigurationException;
import lombok.Data;
import lombok.extern.java.Log;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/** Settings of a standalone stub server, read from YAML and overridden from the command line. */
@Data
@Log
public final class StubCasConfigs {
  private DigestUtil.HashFunction digestFunction = DigestUtil.HashFunction.SHA256;
  private int prometheusPort = 0;
  private Server server = new Server();
  private List<Seed> seeds = new ArrayList<>();

  public static StubCasConfigs loadConfigs(Path configLocation) throws IOException {
    log.info("Loading configs from " + configLocation);
    Yaml yaml = new Yaml(new Constructor(StubCasConfigs.class, new LoaderOptions()));
    StubCasConfigs configs;
    try (InputStream in = Files.newInputStream(configLocation)) {
      configs = yaml.load(in);
    }
    if (configs == null) {
      throw new IOException("Could not load configs from path: " + configLocation);
    }
    log.info(configs.toString());
    return configs;
  }

  /**
   * Builds the configs of the standalone server. The YAML file is optional: its path comes from
   * {@code CONFIG_PATH} or the first positional argument, and defaults apply without one.
   */
  public static StubCasConfigs loadServerConfigs(OptionsParser parser, String[] args)
      throws ConfigurationException {
    try {
      parser.parse(args);
    } catch (OptionsParsingException e) {
      ConfigurationException ce = new ConfigurationException("Could not parse options provided.");
      ce.setRootCause(e);
      throw ce;
    }
    StubCasOptions options = parser.getOptions(StubCasOptions.class);

    Path configPath = getConfigurationPath(System.getenv("CONFIG_PATH"), parser.getResidue());
    StubCasConfigs configs;
    if (configPath == null) {
      configs = new StubCasConfigs();
    } else {
      try {
        configs = loadConfigs(configPath);
      } catch (IOException e) {
        log.severe("Could not parse yml configuration file." + e);
        ConfigurationException ce =
            new ConfigurationException("Could not load configs from path: " + configPath);
        ce.setRootCause(e);
        throw ce;
      }
    }
    configs.applyOptions(options);
    configs.validate();
    return configs;
  }

  @Nullable
  static Path getConfigurationPath(@Nullable String configPathEnv, List<String> residue)
      throws ConfigurationException {
    // source config from env variable
    if (!Strings.isNullOrEmpty(configPathEnv)) {
      return Path.of(configPathEnv);
    }

    // source config from cli
    if (residue.isEmpty()) {
      return null;
    }
    if (residue.size() > 1) {
      throw new ConfigurationException(
          "Unrecognized arguments: " + residue.subList(1, residue.size()));
    }
    return Path.of(residue.get(0));
  }

  public void applyOptions(StubCasOptions options) {
    if (options.port >= 0) {
      server.setPort(options.port);
    }
    if (options.chunkSizeBytes != 0) {
      server.setChunkSizeBytes(options.chunkSizeBytes);
    }
    if (options.alwaysFail) {
      server.setChunkSizeBytes(-1);
    }
    if (options.prometheusPort >= 0) {
      prometheusPort = options.prometheusPort;
    }
  }

  public void validate() throws ConfigurationException {
    if (server.getPort() < 0 || server.getPort() > 65535) {
      throw new ConfigurationException("invalid port: " + server.getPort());
    }
    if (server.getChunkSizeBytes() == 0) {
      throw new ConfigurationException("chunkSizeBytes must not be zero");
    }
    if (server.getMaxInboundMessageSizeBytes() < 0) {
      throw new ConfigurationException(
          "invalid maxInboundMessageSizeBytes: " + server.getMaxInboundMessageSizeBytes());
    }
  }

  public DigestUtil getDigestUtil() {
    return new DigestUtil(digestFunction);
  }

  /** Reads every seed file, keyed by its declared hash or by its computed fingerprint. */
  public Map<HashCode, ByteString> loadSeeds(FileSystem fileSystem) throws IOException {
    DigestUtil digestUtil = getDigestUtil();
    ImmutableMap.Builder<HashCode, ByteString> blobs = ImmutableMap.builder();
    for (Seed seed : seeds) {
      Path path = fileSystem.getPath(seed.getPath());
      ByteString content;
      try (InputStream in = Files.newInputStream(path)) {
        content = ByteString.readFrom(in);
      }
      HashCode fingerprint;
      if (Strings.isNullOrEmpty(seed.getHash())) {
        fingerprint = digestUtil.computeHash(content);
      } else {
        try {
          fingerprint = digestUtil.parseFingerprint(seed.getHash());
        } catch (NumberFormatException e) {
          throw new IOException(String.format("seed %s: %s", path, e.getMessage()), e);
        }
      }
      log.fine(
          String.format("seeding %s with %d bytes from %s", fingerprint, content.size(), path));
      blobs.put(fingerprint, content);
    }
    return blobs.buildKeepingLast();
  }

  public static String usage(OptionsParser parser) {
    return "Usage: [OPTIONS] [CONFIG_PATH]\n"
        + parser.describeOptions(Collections.emptyMap(), OptionsParser.HelpVerbosity.LONG);
  }
}
