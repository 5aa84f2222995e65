package ai.longdoc.translator.codec.ebook;

import ai.longdoc.translator.codec.DecodeException;
import ai.longdoc.translator.codec.DocumentCodec;
import ai.longdoc.translator.codec.DocumentContent;
import ai.longdoc.translator.codec.DocumentFormat;
import ai.longdoc.translator.codec.EncodedDocument;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * EPUB books. Decoding yields the body markup of every spine document in reading order.
 *
 * <p>Encoding does not rebuild an EPUB container: the translated markup is emitted as a flat
 * text artifact.
 */
public class EbookCodec implements DocumentCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(EbookCodec.class);
    private static final String CONTAINER_PATH = "META-INF/container.xml";
    private static final List<String> FALLBACK_PACKAGE_PATHS = List.of("OEBPS/content.opf", "content.opf", "EPUB/content.opf");
    static final String UNIT_SEPARATOR = "\n\n";

    @Override
    public DocumentFormat format() {
        return DocumentFormat.EBOOK;
    }

    @Override
    public DocumentContent decode(byte[] bytes, String sourceName) {
        Map<String, byte[]> archive = readArchive(bytes, sourceName);
        String packagePath = findPackagePath(archive, sourceName);
        Document packageDocument = parseXml(archive.get(packagePath));
        String contentDirectory = parentOf(packagePath);

        List<String> contentPaths = readSpine(packageDocument, contentDirectory);
        List<String> parts = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (String contentPath : contentPaths) {
            try {
                String body = extractBody(archive, contentPath);
                if (!body.isBlank()) {
                    parts.add(body);
                }
            } catch (RuntimeException ex) {
                LOGGER.warn("Skipping unreadable content unit {} in {}: {}", contentPath, sourceName, ex.getMessage());
                skipped.add(contentPath);
            }
        }

        EbookMetadata metadata = new EbookMetadata(
                firstText(packageDocument, "dc|title", "title"),
                firstText(packageDocument, "dc|creator", "creator"),
                contentPaths,
                skipped);
        LOGGER.info("Extracted {} of {} spine documents from '{}' by {}", parts.size(), contentPaths.size(),
                metadata.title(), metadata.author());
        return new DocumentContent(String.join(UNIT_SEPARATOR, parts), DocumentFormat.EBOOK, sourceName, Optional.of(metadata));
    }

    @Override
    public boolean requiresStructuralReassembly() {
        return true;
    }

    @Override
    public EncodedDocument encode(String translatedText, DocumentContent original) {
        return new EncodedDocument("assembled_" + original.stem() + ".txt", translatedText.getBytes(StandardCharsets.UTF_8));
    }

    private Map<String, byte[]> readArchive(byte[] bytes, String sourceName) {
        Map<String, byte[]> archive = new LinkedHashMap<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(bytes), StandardCharsets.UTF_8)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (!entry.isDirectory()) {
                    archive.put(entry.getName(), zip.readAllBytes());
                }
            }
        } catch (IOException | IllegalArgumentException ex) {
            throw new DecodeException("Corrupt EPUB archive " + sourceName, ex);
        }
        if (archive.isEmpty()) {
            throw new DecodeException("EPUB archive " + sourceName + " contains no entries");
        }
        return archive;
    }

    private String findPackagePath(Map<String, byte[]> archive, String sourceName) {
        byte[] container = archive.get(CONTAINER_PATH);
        if (container != null) {
            Element rootFile = parseXml(container).selectFirst("rootfile[full-path]");
            if (rootFile != null && archive.containsKey(rootFile.attr("full-path"))) {
                return rootFile.attr("full-path");
            }
            LOGGER.warn("{} in {} does not point at a package document; trying default locations", CONTAINER_PATH, sourceName);
        }
        return FALLBACK_PACKAGE_PATHS.stream()
                .filter(archive::containsKey)
                .findFirst()
                .orElseThrow(() -> new DecodeException("Could not find the package document (content.opf) in " + sourceName));
    }

    private List<String> readSpine(Document packageDocument, String contentDirectory) {
        Map<String, String> manifest = new HashMap<>();
        for (Element item : packageDocument.select("manifest > item[id][href]")) {
            manifest.put(item.attr("id"), item.attr("href"));
        }
        List<String> contentPaths = new ArrayList<>();
        for (Element itemRef : packageDocument.select("spine > itemref[idref]")) {
            String href = manifest.get(itemRef.attr("idref"));
            if (href == null) {
                LOGGER.debug("Spine references unknown manifest item {}", itemRef.attr("idref"));
                continue;
            }
            contentPaths.add(contentDirectory.isEmpty() ? href : contentDirectory + "/" + href);
        }
        return contentPaths;
    }

    private String extractBody(Map<String, byte[]> archive, String contentPath) {
        byte[] content = archive.get(contentPath);
        if (content == null) {
            throw new IllegalStateException("missing from archive");
        }
        Document document = Jsoup.parse(new String(content, StandardCharsets.UTF_8));
        document.outputSettings().prettyPrint(false);
        return document.body().html().strip();
    }

    private static Document parseXml(byte[] bytes) {
        return Jsoup.parse(new String(bytes, StandardCharsets.UTF_8), "", Parser.xmlParser());
    }

    private static String firstText(Document document, String... selectors) {
        for (String selector : selectors) {
            Element element = document.selectFirst(selector);
            if (element != null && !element.text().isBlank()) {
                return element.text();
            }
        }
        return null;
    }

    private static String parentOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }
}
