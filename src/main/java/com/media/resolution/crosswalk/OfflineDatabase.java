package com.media.resolution.crosswalk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.media.resolution.core.model.CatalogService;
import com.media.resolution.core.model.MediaKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Anime id pairs from the manami-project anime-offline-database dump.
 *
 * <p>The dump is a single JSON object whose {@code data} array holds one entry per title,
 * each listing the title's pages on several sites under {@code sources}. Only entries with
 * both a MyAnimeList and an AniList page are indexed. The array is read one entry at a time.</p>
 */
public class OfflineDatabase implements IdCrosswalk {
    private static final Logger log = LoggerFactory.getLogger(OfflineDatabase.class);

    static final String MAL_PREFIX = "https://myanimelist.net/anime/";
    static final String ANILIST_PREFIX = "https://anilist.co/anime/";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<Integer, Integer> anilistByMal = new HashMap<>();
    private final Map<Integer, Integer> malByAnilist = new HashMap<>();

    private OfflineDatabase() {
    }

    /**
     * Builds a database from already-parsed entries.
     */
    public static OfflineDatabase fromEntries(Collection<Entry> entries) {
        OfflineDatabase db = new OfflineDatabase();
        entries.forEach(db::index);
        return db;
    }

    public static OfflineDatabase load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            OfflineDatabase db = parse(in);
            log.info("offline.database.loaded file={} pairs={}", file, db.size());
            return db;
        } catch (IOException e) {
            throw new CrosswalkException("read offline database " + file, e);
        }
    }

    /**
     * Streams the dump from {@code in}. The stream is not closed.
     */
    public static OfflineDatabase parse(InputStream in) {
        OfflineDatabase db = new OfflineDatabase();
        JsonFactory factory = MAPPER.getFactory();
        try (JsonParser parser = factory.createParser(in)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new CrosswalkException("offline database: expected a JSON object");
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.currentName();
                JsonToken value = parser.nextToken();
                if ("data".equals(field) && value == JsonToken.START_ARRAY) {
                    while (parser.nextToken() == JsonToken.START_OBJECT) {
                        db.index(MAPPER.readValue(parser, Entry.class));
                    }
                } else {
                    parser.skipChildren();
                }
            }
        } catch (IOException e) {
            throw new CrosswalkException("parse offline database", e);
        }
        return db;
    }

    @Override
    public OptionalInt lookup(CatalogService from, MediaKind kind, int id) {
        if (kind != MediaKind.ANIME || id <= 0) {
            return OptionalInt.empty();
        }
        Integer paired = from == CatalogService.MYANIMELIST ? anilistByMal.get(id) : malByAnilist.get(id);
        return paired == null ? OptionalInt.empty() : OptionalInt.of(paired);
    }

    @Override
    public boolean supports(MediaKind kind) {
        return kind == MediaKind.ANIME;
    }

    @Override
    public String getName() {
        return "offline-database";
    }

    public int size() {
        return anilistByMal.size();
    }

    private void index(Entry entry) {
        if (entry.sources() == null) {
            return;
        }
        int malId = 0;
        int anilistId = 0;
        for (String source : entry.sources()) {
            malId = malId > 0 ? malId : extractId(source, MAL_PREFIX);
            anilistId = anilistId > 0 ? anilistId : extractId(source, ANILIST_PREFIX);
        }
        if (malId > 0 && anilistId > 0) {
            anilistByMal.put(malId, anilistId);
            malByAnilist.put(anilistId, malId);
        }
    }

    /**
     * Returns the numeric id following {@code prefix} in {@code url}, or 0.
     * A trailing path such as {@code /some-title} is ignored.
     */
    static int extractId(String url, String prefix) {
        if (url == null || !url.startsWith(prefix)) {
            return 0;
        }
        String rest = url.substring(prefix.length());
        int slash = rest.indexOf('/');
        if (slash >= 0) {
            rest = rest.substring(0, slash);
        }
        try {
            int id = Integer.parseInt(rest);
            return Math.max(id, 0);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * One title of the dump; only the fields used for indexing are bound.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(List<String> sources, String title, String type) {
    }
}
