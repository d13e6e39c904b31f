/*
 * Copyright (c) 2023-2025 Burak Sezer
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

package com.tessera;

import com.tessera.cqm.BuildSettings;
import com.tessera.planner.optimizer.OptimizerSettings;
import com.tessera.psl.ProjectionLimits;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CompilerSettingsTest {

    private static Config withOverrides(String hocon) {
        return ConfigFactory.parseString(hocon).withFallback(ConfigFactory.defaultReference()).resolve();
    }

    @Test
    void shouldLoadDefaultsFromReferenceConf() {
        CompilerSettings settings = CompilerSettings.load();

        assertEquals(BuildSettings.DEFAULT, settings.getBuildSettings());
        assertEquals(ProjectionLimits.DEFAULT, settings.getBuildSettings().projectionLimits());
        assertEquals(OptimizerSettings.DEFAULT, settings.getOptimizerSettings());
        assertEquals(Duration.ofSeconds(5), settings.getDefaultTimeout());
        assertEquals(10.0, settings.getMisestimateRatio());
    }

    @Test
    void shouldApplyOverrides() {
        CompilerSettings settings = CompilerSettings.fromConfig(withOverrides(
                "tessera.query.default_page_size = 20\n"
                        + "tessera.query.default_timeout = 250ms\n"
                        + "tessera.projection.max_recursive_wildcards = 1\n"
                        + "tessera.optimizer.index_selectivity_threshold = 0.05\n"
                        + "tessera.explain.misestimate_ratio = 4"));

        assertEquals(20, settings.getBuildSettings().defaultPageSize());
        assertEquals(1000, settings.getBuildSettings().maxPageSize());
        assertEquals(1, settings.getBuildSettings().projectionLimits().maxRecursiveWildcards());
        assertEquals(0.05, settings.getOptimizerSettings().indexSelectivityThreshold());
        assertEquals(Duration.ofMillis(250), settings.getDefaultTimeout());
        assertEquals(4.0, settings.getMisestimateRatio());
    }

    @Test
    void shouldRejectInconsistentValues() {
        assertThrows(IllegalArgumentException.class,
                () -> CompilerSettings.fromConfig(withOverrides("tessera.query.default_page_size = 5000")));
        assertThrows(IllegalArgumentException.class,
                () -> CompilerSettings.fromConfig(withOverrides("tessera.query.default_timeout = 0s")));
        assertThrows(IllegalArgumentException.class,
                () -> CompilerSettings.fromConfig(withOverrides("tessera.projection.max_patterns = 0")));
    }

    @Test
    void shouldRejectMalformedValues() {
        assertThrows(ConfigException.WrongType.class,
                () -> CompilerSettings.fromConfig(withOverrides("tessera.query.max_page_size = lots")));
        assertThrows(ConfigException.Missing.class,
                () -> CompilerSettings.fromConfig(ConfigFactory.parseString("tessera.query.max_page_size = 10")));
    }
}
