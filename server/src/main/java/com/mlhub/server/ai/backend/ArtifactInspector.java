package com.mlhub.server.ai.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Reads the table of contents of PyTorch archives to tell a full TorchScript
 * program from a bare weights dump, and picks up detection export metadata
 * stored as the {@code extra/config.txt} entry.
 */
public class ArtifactInspector {

    private static final Logger logger = LoggerFactory.getLogger(ArtifactInspector.class);

    private static final String CONFIG_ENTRY_SUFFIX = "extra/config.txt";

    private final ObjectMapper mapper = new ObjectMapper();

    public ArtifactProfile inspect(Path path) {
        if (!Files.isRegularFile(path)) {
            return ArtifactProfile.unknown();
        }
        try (ZipFile zip = new ZipFile(path.toFile())) {
            boolean hasCode = false;
            boolean hasPickle = false;
            ZipEntry configEntry = null;
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                String name = entry.getName();
                if (name.contains("/code/") || name.startsWith("code/")) {
                    hasCode = true;
                } else if (name.endsWith("data.pkl")) {
                    hasPickle = true;
                } else if (name.endsWith(CONFIG_ENTRY_SUFFIX)) {
                    configEntry = entry;
                }
            }

            if (!hasCode) {
                ArtifactProfile.Format format = hasPickle ? ArtifactProfile.Format.WEIGHTS_ONLY
                        : ArtifactProfile.Format.UNKNOWN;
                return new ArtifactProfile(format, null, List.of(), 0);
            }
            if (configEntry == null) {
                return new ArtifactProfile(ArtifactProfile.Format.TORCHSCRIPT, null, List.of(), 0);
            }
            try (InputStream is = zip.getInputStream(configEntry)) {
                return fromExportMetadata(mapper.readTree(is));
            }
        } catch (ZipException e) {
            return new ArtifactProfile(ArtifactProfile.Format.NOT_AN_ARCHIVE, null, List.of(), 0);
        } catch (IOException e) {
            logger.warn("Could not inspect {}: {}", path, e.getMessage());
            return ArtifactProfile.unknown();
        }
    }

    ArtifactProfile fromExportMetadata(JsonNode meta) {
        if (meta == null || !meta.isObject()) {
            return new ArtifactProfile(ArtifactProfile.Format.TORCHSCRIPT, null, List.of(), 0);
        }
        String task = meta.hasNonNull("task") ? meta.get("task").asText() : null;
        return new ArtifactProfile(ArtifactProfile.Format.TORCHSCRIPT, task, classNames(meta.get("names")),
                imageSize(meta.get("imgsz")));
    }

    private static List<String> classNames(JsonNode names) {
        List<String> out = new ArrayList<>();
        if (names == null) {
            return out;
        }
        if (names.isArray()) {
            for (JsonNode n : names) {
                out.add(n.asText());
            }
            return out;
        }
        if (names.isObject()) {
            // keys are stringified class ids
            TreeMap<Integer, String> byId = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = names.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                try {
                    byId.put(Integer.parseInt(e.getKey().trim()), e.getValue().asText());
                } catch (NumberFormatException ex) {
                    logger.debug("Ignoring non-numeric class id '{}'", e.getKey());
                }
            }
            int size = byId.isEmpty() ? 0 : byId.lastKey() + 1;
            for (int i = 0; i < size; i++) {
                out.add(byId.getOrDefault(i, String.valueOf(i)));
            }
        }
        return out;
    }

    private static int imageSize(JsonNode imgsz) {
        if (imgsz == null) {
            return 0;
        }
        if (imgsz.isArray() && imgsz.size() > 0) {
            return imgsz.get(0).asInt();
        }
        return imgsz.asInt();
    }
}
