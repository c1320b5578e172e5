/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.opendata.harvest;

import org.opendata.harvest.config.DatasetDescriptor;
import org.opendata.harvest.config.HarvestConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point.
 *
 * <p>Usage:
 * <pre>
 * java -jar harvest.jar harvest.yaml [--all | datasetId ...] [--incremental]
 * </pre>
 *
 * <p>Datasets may be named by id or output name; with no dataset arguments
 * every configured dataset is harvested. The process exits with status 1 if
 * any dataset failed.
 */
public class Main {

  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  private Main() {
  }

  public static void main(String[] args) {
    int status;
    try {
      status = run(args);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.error("Interrupted");
      status = 1;
    }
    System.exit(status);
  }

  /**
   * Runs a harvest and returns the process exit status.
   */
  static int run(String[] args) throws InterruptedException {
    if (args.length < 1) {
      usage();
      return 1;
    }
    Path configPath = Paths.get(args[0]);
    if (!Files.isRegularFile(configPath)) {
      System.err.println("Error: configuration file not found: " + configPath);
      return 1;
    }

    boolean incremental = false;
    boolean all = false;
    List<String> requested = new ArrayList<String>();
    for (int i = 1; i < args.length; i++) {
      String arg = args[i];
      if ("--incremental".equals(arg)) {
        incremental = true;
      } else if ("--all".equals(arg)) {
        all = true;
      } else if (arg.startsWith("--")) {
        System.err.println("Error: unknown option " + arg);
        usage();
        return 1;
      } else {
        requested.add(arg);
      }
    }
    if (all && !requested.isEmpty()) {
      System.err.println("Error: --all cannot be combined with dataset ids");
      return 1;
    }

    HarvestConfig config;
    try {
      config = HarvestConfig.load(configPath);
    } catch (IOException e) {
      LOGGER.error("Failed to load configuration {}", configPath, e);
      return 1;
    }

    List<DatasetDescriptor> datasets = new ArrayList<DatasetDescriptor>();
    if (requested.isEmpty()) {
      datasets.addAll(config.getDatasets());
    } else {
      for (String name : requested) {
        DatasetDescriptor dataset = config.findDataset(name);
        if (dataset == null) {
          System.err.println("Error: unknown dataset " + name);
          return 1;
        }
        datasets.add(dataset);
      }
    }
    if (datasets.isEmpty()) {
      System.err.println("Error: no datasets configured in " + configPath);
      return 1;
    }

    HarvestResult result = new HarvestPipeline(config).run(datasets, incremental);
    return result.isCompleteSuccess() ? 0 : 1;
  }

  private static void usage() {
    System.err.println("Usage: Main <config.yaml> [--all | datasetId ...] [--incremental]");
    System.err.println();
    System.err.println("Options:");
    System.err.println("  --all          harvest every configured dataset (default)");
    System.err.println("  --incremental  fetch only rows since each dataset's watermark");
  }
}
