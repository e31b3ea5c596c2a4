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

import lombok.extern.log4j.Log4j2;
import lombok.val;

import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * A snapshot of properties, read once when the configuration is built. Property files are read as UTF-8.
 */
@Log4j2
class PropertiesConfigurationSource implements StringPropertySource {
    private final Properties properties;

    private PropertiesConfigurationSource(Properties properties) {
        this.properties = properties;
    }

    static PropertiesConfigurationSource ofSystemProperties() {
        return of(System.getProperties());
    }

    static PropertiesConfigurationSource of(Properties properties) {
        val copy = new Properties();
        copy.putAll(properties);
        return new PropertiesConfigurationSource(copy);
    }

    /**
     * A missing file contributes no values.
     */
    static PropertiesConfigurationSource ofOptionalFile(Path file) throws IOException {
        val properties = new Properties();
        if (Files.isRegularFile(file)) {
            try (val in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                properties.load(in);
            }
            log.debug("Read {} settings from {}", properties.size(), file.toAbsolutePath());
        } else {
            log.debug("No settings file at {}", file.toAbsolutePath());
        }
        return new PropertiesConfigurationSource(properties);
    }

    /**
     * A missing classpath resource contributes no values.
     */
    static PropertiesConfigurationSource ofResource(String resourceName) throws IOException {
        val properties = new Properties();
        try (val in = PropertiesConfigurationSource.class.getResourceAsStream(resourceName)) {
            if (null == in) {
                log.debug("No settings resource {}", resourceName);
            } else {
                properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        }
        return new PropertiesConfigurationSource(properties);
    }

    @Override
    public Optional<String> getConfigValue(String key) {
        return Optional.ofNullable(properties.getProperty(key));
    }

    @Override
    public Set<String> getConfigKeys() {
        return new TreeSet<>(properties.stringPropertyNames());
    }
}
