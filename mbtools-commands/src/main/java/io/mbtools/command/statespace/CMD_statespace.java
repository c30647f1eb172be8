package io.mbtools.command.statespace;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.mbtools.config.ConfigurationLoadException;
import io.mbtools.config.ConfigurationLoader;
import io.mbtools.model.statespace.FixedBaseSpace;
import io.mbtools.model.statespace.FloatingBaseSpace;
import io.mbtools.model.statespace.ProductSpace;
import io.mbtools.model.statespace.StateSpace;
import io.mbtools.model.statespace.StateSpaceBuilder;
import io.mbtools.model.topology.ModelInstance;
import io.mbtools.model.topology.StaticPlantTopology;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/// Print the state space of a plant
///
/// One line per model instance, in state-vector order, followed by the totals:
///
/// ```text
/// WorldModelInstance  fixed     nq=0   nv=0   q@0   v@0
/// cube                floating  nq=7   nv=6   q@0   v@0
/// elbow               floating  nq=8   nv=7   q@7   v@6
/// total                         nq=15  nv=13
/// ```
@CommandLine.Command(name = "statespace",
    description = "Print the per-model state space factors and totals of a plant")
public class CMD_statespace implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_statespace.class);

    @CommandLine.Option(names = {"-p", "--plant"}, required = true, description = "Plant description JSON file")
    private Path plantPath;

    @Override
    public Integer call() {
        try {
            StaticPlantTopology topology = StaticPlantTopology.of(ConfigurationLoader.loadPlant(plantPath));
            ProductSpace space = StateSpaceBuilder.build(topology);
            List<ModelInstance> instances = topology.modelInstances();
            for (int i = 0; i < space.factorCount(); i++) {
                StateSpace factor = space.factor(i);
                System.out.printf("%-20s %-9s nq=%-4d nv=%-4d q@%-4d v@%d%n",
                    instances.get(i).name(), kind(factor), factor.positionDimension(), factor.velocityDimension(),
                    space.positionOffset(i), space.velocityOffset(i));
            }
            System.out.printf("%-20s %-9s nq=%-4d nv=%d%n", "total", "",
                space.positionDimension(), space.velocityDimension());
            return 0;
        } catch (ConfigurationLoadException e) {
            System.err.println("Error: " + e.getMessage());
            logger.error("Failed to load plant {}", plantPath, e);
            return 1;
        } catch (RuntimeException e) {
            System.err.println("Error: " + e.getMessage());
            logger.error("Failed to build state space for {}", plantPath, e);
            return 1;
        }
    }

    private static String kind(StateSpace space) {
        if (space instanceof FloatingBaseSpace) {
            return "floating";
        } else if (space instanceof FixedBaseSpace) {
            return "fixed";
        }
        return "product";
    }
}
