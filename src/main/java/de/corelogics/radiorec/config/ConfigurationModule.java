/*
 * MIT License
 *
 * Copyright (c) 2026 Radio Recorder Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package de.corelogics.radiorec.config;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.io.File;
import java.io.IOException;

@Log4j2
public class ConfigurationModule {
    @Getter
    private final MainConfiguration mainConfiguration;

    public ConfigurationModule() throws IOException {
        this(new File(new File("config"), "application.properties"));
    }

    ConfigurationModule(File fileSystemProperties) throws IOException {
        log.debug("Loading configuration, file system properties from {}", fileSystemProperties::getAbsolutePath);
        this.mainConfiguration = new MainConfiguration(
            new TypedConfigurationAccessor(
                new LayeredPropertySource(
                    PropertiesConfigurationSource.ofSystemProperties(),
                    new MapConfigurationSource(System.getenv()),
                    PropertiesConfigurationSource.ofOptionalFile(fileSystemProperties.toPath()),
                    PropertiesConfigurationSource.ofResource("/application.properties"))));
    }
}
