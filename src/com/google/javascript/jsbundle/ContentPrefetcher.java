/*
 * Copyright 2024 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.javascript.jsbundle;

import com.google.common.collect.Iterables;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Loads the content of many assets in parallel. Content is memoized by each {@link
 * CommittedAsset} the first time it is requested, so loading it all ahead of packaging means
 * packagers find it already materialized.
 */
class ContentPrefetcher {
  private static final Logger logger = Logger.getLogger(ContentPrefetcher.class.getName());

  private final int numParallelThreads;

  ContentPrefetcher(int numParallelThreads) {
    this.numParallelThreads = numParallelThreads;
  }

  void prefetch(Iterable<CommittedAsset> assets) {
    ThreadFactory threadFactory =
        r -> {
          Thread t = new Thread(r, "jsbundle-ContentPrefetcher");
          t.setDaemon(true); // Do not prevent the JVM from exiting.
          return t;
        };
    ThreadPoolExecutor poolExecutor =
        new ThreadPoolExecutor(
            numParallelThreads,
            numParallelThreads,
            Integer.MAX_VALUE,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<Runnable>(),
            threadFactory);
    ListeningExecutorService executorService = MoreExecutors.listeningDecorator(poolExecutor);
    List<ListenableFuture<byte[]>> futureList = new ArrayList<>(Iterables.size(assets));
    for (CommittedAsset asset : assets) {
      futureList.add(Futures.submitAsync(asset::materialize, executorService));
    }
    logger.fine(() -> "Prefetching content of " + futureList.size() + " assets");

    poolExecutor.shutdown();
    try {
      Futures.allAsList(futureList).get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    } catch (ExecutionException e) {
      throw new RuntimeException(e.getCause());
    }
  }
}
