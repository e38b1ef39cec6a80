/*
 * Docx2Tex - Office Open XML to LaTeX Conversion
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.docx2tex.core;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/** Output settings: the preamble of the generated file and the image options. */
public final class ConversionProfile {
    private static final String DEFAULT_PROFILE_RESOURCE = "/profile-default.yaml";
    private static final Logger logger = LoggerFactory.getLogger(ConversionProfile.class);

    static final String DEFAULT_DOCUMENT_CLASS = "article";
    static final List<String> DEFAULT_PACKAGES = List.of("graphicx", "hyperref", "amsmath");
    static final String DEFAULT_GRAPHICS_OPTIONS = "width=\\textwidth";

    public String document_class = DEFAULT_DOCUMENT_CLASS;
    public List<String> packages = new ArrayList<>(DEFAULT_PACKAGES);
    public String graphics_options = DEFAULT_GRAPHICS_OPTIONS;

    public ConversionProfile() {}

    public String documentClass() {
        return document_class;
    }

    public List<String> packages() {
        return packages != null ? packages : List.of();
    }

    /** Option list for {@code \includegraphics}, without brackets. */
    public String graphicsOptions() {
        return graphics_options;
    }

    /** Profile built in code, equal to the bundled default resource. */
    public static ConversionProfile defaults() {
        return new ConversionProfile();
    }

    /**
     * Load a profile from a classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static ConversionProfile fromResource(String resourcePath) {
        try (var inputStream = ConversionProfile.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            return load(inputStream, resourcePath);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to load profile from resource " + resourcePath + ": " + e.getMessage(),
                    e);
        }
    }

    public static ConversionProfile fromFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        }
    }

    /** Load default profile from standard location */
    public static ConversionProfile loadDefault() {
        return fromResource(DEFAULT_PROFILE_RESOURCE);
    }

    private static ConversionProfile load(InputStream in, String origin) {
        var yaml = new Yaml(new Constructor(ConversionProfile.class, new LoaderOptions()));
        ConversionProfile profile;
        try {
            profile = yaml.load(in);
        } catch (RuntimeException e) {
            logger.error("Failed to parse profile {}: {}", origin, e.getMessage());
            throw new IllegalArgumentException(
                    "Invalid profile " + origin + ": " + e.getMessage(), e);
        }
        if (profile == null) {
            logger.warn("Profile {} is empty; using defaults", origin);
            return defaults();
        }

        var warnings = profile.validate();
        if (!warnings.isEmpty()) {
            logger.warn("Profile loaded from {} has {} warnings:", origin, warnings.size());
            for (String warning : warnings) {
                logger.warn("  - {}", warning);
            }
        }
        logger.debug(
                "Loaded profile from {}: class={}, {} packages",
                origin,
                profile.documentClass(),
                profile.packages().size());
        return profile;
    }

    /** Returns warnings about values that would produce a broken preamble. */
    public List<String> validate() {
        List<String> warnings = new ArrayList<>();
        if (document_class == null || document_class.isBlank()) {
            warnings.add("document_class is blank; falling back to " + DEFAULT_DOCUMENT_CLASS);
            document_class = DEFAULT_DOCUMENT_CLASS;
        }
        if (packages == null) {
            packages = new ArrayList<>();
        } else if (packages.removeIf(p -> p == null || p.isBlank())) {
            warnings.add("packages contained blank entries, which were dropped");
        }
        if (!packages.contains("graphicx")) {
            warnings.add("graphicx is not loaded; \\includegraphics will not compile");
        }
        if (!packages.contains("hyperref")) {
            warnings.add("hyperref is not loaded; \\href and \\hyperlink will not compile");
        }
        return warnings;
    }
}
