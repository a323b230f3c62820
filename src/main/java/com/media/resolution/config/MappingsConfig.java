package com.media.resolution.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.media.resolution.core.model.CatalogService;
import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.core.model.SyncDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Manual id mappings and ignore rules, read from a YAML file:
 *
 * <pre>
 * manual_mappings:
 *   - anilist_id: 21
 *     mal_id: 21
 *     comment: "One Piece"
 * ignore:
 *   anilist_ids: [1]
 *   mal_ids: [2]
 *   titles: ["Some Title"]
 * </pre>
 */
public class MappingsConfig {
    private static final Logger log = LoggerFactory.getLogger(MappingsConfig.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final List<ManualMapping> manualMappings;
    private final IgnoreRules ignore;
    private final Map<Integer, Integer> malByAnilist = new HashMap<>();
    private final Map<Integer, Integer> anilistByMal = new HashMap<>();
    private final Set<String> ignoredTitles = new HashSet<>();

    public MappingsConfig(List<ManualMapping> manualMappings, IgnoreRules ignore) {
        this.manualMappings = manualMappings == null ? List.of() : List.copyOf(manualMappings);
        this.ignore = ignore == null ? IgnoreRules.none() : ignore;
        for (ManualMapping mapping : this.manualMappings) {
            if (mapping.anilistId() > 0 && mapping.malId() > 0) {
                malByAnilist.put(mapping.anilistId(), mapping.malId());
                anilistByMal.put(mapping.malId(), mapping.anilistId());
            } else {
                log.warn("mappings.invalid anilistId={} malId={} comment={}",
                        mapping.anilistId(), mapping.malId(), mapping.comment());
            }
        }
        for (String title : this.ignore.titles()) {
            ignoredTitles.add(title.toLowerCase(Locale.ROOT));
        }
    }

    public static MappingsConfig empty() {
        return new MappingsConfig(List.of(), IgnoreRules.none());
    }

    /**
     * Loads the file at {@code path}. A missing file yields an empty configuration.
     *
     * @throws MappingsConfigException if the file cannot be read or parsed
     */
    public static MappingsConfig load(Path path) {
        if (!Files.exists(path)) {
            log.debug("mappings.missing path={}", path);
            return empty();
        }
        try (InputStream in = Files.newInputStream(path)) {
            MappingsConfig config = parse(in);
            log.info("mappings.loaded path={} manual={} ignoredTitles={}",
                    path, config.manualMappings.size(), config.ignoredTitles.size());
            return config;
        } catch (IOException e) {
            throw new MappingsConfigException("read mappings file " + path, e);
        }
    }

    /**
     * Parses YAML from a stream. The stream is not closed.
     */
    public static MappingsConfig parse(InputStream in) {
        try {
            JsonNode root = YAML.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                return empty();
            }
            FileModel model = YAML.treeToValue(root, FileModel.class);
            return new MappingsConfig(model.manualMappings, model.ignore);
        } catch (IOException e) {
            throw new MappingsConfigException("parse mappings", e);
        }
    }

    public List<ManualMapping> getManualMappings() {
        return manualMappings;
    }

    public IgnoreRules getIgnore() {
        return ignore;
    }

    public boolean hasManualMappings() {
        return !manualMappings.isEmpty();
    }

    /**
     * Returns the id in {@code destination} that the operator paired with {@code id} in the other catalog.
     */
    public OptionalInt manualMapping(CatalogService destination, int id) {
        Map<Integer, Integer> index = destination == CatalogService.MYANIMELIST ? malByAnilist : anilistByMal;
        Integer mapped = index.get(id);
        return mapped == null ? OptionalInt.empty() : OptionalInt.of(mapped);
    }

    /**
     * Returns true if the source should be left out of a pass in the given direction.
     * Ids are checked against the ignore list of the source catalog.
     */
    public boolean isIgnored(MediaEntry source, SyncDirection direction) {
        if (ignoredTitles.contains(source.getTitle().toLowerCase(Locale.ROOT))) {
            return true;
        }
        int sourceId = direction.sourceId(source);
        if (sourceId <= 0) {
            return false;
        }
        List<Integer> ids = direction.getSource() == CatalogService.ANILIST ? ignore.anilistIds() : ignore.malIds();
        return ids.contains(sourceId);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class FileModel {
        @JsonProperty("manual_mappings")
        List<ManualMapping> manualMappings;

        @JsonProperty("ignore")
        IgnoreRules ignore;
    }
}
