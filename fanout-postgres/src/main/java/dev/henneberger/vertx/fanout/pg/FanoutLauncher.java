/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.fanout.pg;

import dev.henneberger.vertx.fanout.core.DependencyResolver;
import dev.henneberger.vertx.fanout.core.InMemorySchemaCatalog;
import io.vertx.core.Vertx;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the fan-out engine for every data store of a {@link FanoutConfig}. See {@link ReplicationAppConfig} for the
 * environment variables it reads.
 */
public final class FanoutLauncher {

  private static final Logger LOG = LoggerFactory.getLogger(FanoutLauncher.class);

  private FanoutLauncher() {
  }

  public static void main(String[] args) throws Exception {
    ReplicationAppConfig appConfig = ReplicationAppConfig.fromEnv();
    FanoutConfig config = FanoutConfig.load(appConfig.configPath());
    LOG.info("Loaded {} connection(s) and {} data store(s) from {}",
      config.connections().size(), config.dataStores().size(), appConfig.configPath());

    Vertx vertx = Vertx.vertx();
    ConnectionRegistry registry = new ConnectionRegistry(config.connections());
    InMemorySchemaCatalog catalog = config.catalog();
    ChangeTransformationPipeline pipeline = new ChangeTransformationPipeline(
      new ChangesService(catalog),
      new DependencyResolver(catalog, catalog),
      new JdbcTransformationExecutor(vertx, registry));
    ChangeFanoutService service = new ChangeFanoutService(
      vertx, registry, config.dataStores(), pipeline, appConfig.applyTo(config.listenerOptions()));

    CountDownLatch shutdown = new CountDownLatch(1);
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      LOG.info("Shutting down");
      shutdown(vertx, registry, service);
      shutdown.countDown();
    }, "fanout-shutdown"));

    service.startAll(appConfig.listenForMs()).onComplete(ar -> {
      if (ar.failed()) {
        LOG.error("Startup failed", ar.cause());
        shutdown.countDown();
        return;
      }
      for (StartResult result : ar.result()) {
        LOG.info("{}: {}", result.connectionSlug(), result.status());
      }
      if (appConfig.listenForMs() != null) {
        shutdown.countDown();
      }
    });

    shutdown.await();
    shutdown(vertx, registry, service);
  }

  private static synchronized void shutdown(Vertx vertx, ConnectionRegistry registry, ChangeFanoutService service) {
    service.close();
    registry.close();
    vertx.close();
  }
}
