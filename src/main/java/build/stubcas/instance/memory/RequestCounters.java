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

package build.stubcas.instance.memory;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.concurrent.GuardedBy;

/** Request observations exposed to tests. Both counters only ever grow. */
public class RequestCounters {
  private final AtomicLong readRequestCount = new AtomicLong(0L);

  @GuardedBy("this")
  private final List<Integer> writeMessageSizes = new ArrayList<>();

  public void incrementReadRequests() {
    readRequestCount.incrementAndGet();
  }

  public long getReadRequestCount() {
    return readRequestCount.get();
  }

  public synchronized void recordWriteMessage(int size) {
    writeMessageSizes.add(size);
  }

  public synchronized List<Integer> getWriteMessageSizes() {
    return ImmutableList.copyOf(writeMessageSizes);
  }
}
