package com.example.catalog_import.service.source.nzb;

import com.example.catalog_import.service.source.AnalysisException;
import com.example.catalog_import.service.source.SourceFiles;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads NZB XML: head metadata, per-file subject, poster, groups and segment sizes.
 */
public final class NzbParser {
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");
    private static final Pattern BEFORE_YENC = Pattern.compile("]\\s*-?\\s*(.+?)\\s+yEnc", Pattern.CASE_INSENSITIVE);
    private static final Pattern FILE_WITH_EXTENSION = Pattern.compile(
            "([\\w.\\-() \\[\\]]+\\.(?:mkv|mp4|avi|mov|wmv|flv|webm|m4v|mpg|mpeg|ts|m2ts|vob|rar|r\\d{2}|zip|7z|par2|nfo|sfv|srt|nzb))",
            Pattern.CASE_INSENSITIVE);

    private NzbParser() {
    }

    public static NzbDocument parse(String content) {
        if (content == null || content.isBlank()) {
            throw AnalysisException.malformed("NZB content is empty");
        }
        Document doc = readXml(content);
        Element root = doc.getDocumentElement();
        if (root == null || !"nzb".equalsIgnoreCase(localName(root))) {
            throw AnalysisException.unsupported("Document is not an NZB (root element '" + (root == null ? "" : localName(root)) + "')");
        }

        String title = null;
        String password = null;
        String category = null;
        NodeList metas = root.getElementsByTagNameNS("*", "meta");
        for (int i = 0; i < metas.getLength(); i++) {
            Element meta = (Element) metas.item(i);
            String type = meta.getAttribute("type").toLowerCase(Locale.ROOT);
            String value = meta.getTextContent() == null ? null : meta.getTextContent().trim();
            if (value == null || value.isEmpty()) {
                continue;
            }
            switch (type) {
                case "name", "title" -> title = title == null ? value : title;
                case "password" -> password = value;
                case "category" -> category = value;
                default -> {
                }
            }
        }

        List<NzbDocument.NzbFile> files = new ArrayList<>();
        Set<String> allGroups = new LinkedHashSet<>();
        NodeList fileNodes = root.getElementsByTagNameNS("*", "file");
        for (int i = 0; i < fileNodes.getLength(); i++) {
            Element file = (Element) fileNodes.item(i);
            String subject = file.getAttribute("subject");
            List<String> groups = texts(file, "group");
            allGroups.addAll(groups);
            long bytes = 0;
            int segmentCount = 0;
            NodeList segments = file.getElementsByTagNameNS("*", "segment");
            for (int s = 0; s < segments.getLength(); s++) {
                String raw = ((Element) segments.item(s)).getAttribute("bytes");
                if (raw.matches("\\d{1,15}")) {
                    bytes += Long.parseLong(raw);
                }
                segmentCount++;
            }
            String date = file.getAttribute("date");
            files.add(new NzbDocument.NzbFile(
                    subject,
                    filenameFromSubject(subject),
                    emptyToNull(file.getAttribute("poster")),
                    date.matches("\\d{1,12}") ? Long.parseLong(date) : null,
                    groups,
                    bytes,
                    segmentCount));
        }
        if (files.isEmpty()) {
            throw AnalysisException.malformed("NZB contains no files");
        }
        String guid = SourceFiles.sha256Hex(content.getBytes(StandardCharsets.UTF_8)).substring(0, 40);
        return new NzbDocument(guid, title, password, category, files, new ArrayList<>(allGroups));
    }

    /**
     * Subject lines look like {@code [01/20] - "Show.S01E01.mkv" yEnc (1/50)}; the quoted part wins, then
     * the text between the last bracket and {@code yEnc}, then anything that looks like a file name.
     */
    public static String filenameFromSubject(String subject) {
        if (subject == null || subject.isBlank()) {
            return "unknown";
        }
        Matcher quoted = QUOTED.matcher(subject);
        if (quoted.find()) {
            return quoted.group(1).trim();
        }
        Matcher yenc = BEFORE_YENC.matcher(subject);
        if (yenc.find()) {
            return yenc.group(1).trim();
        }
        Matcher ext = FILE_WITH_EXTENSION.matcher(subject);
        if (ext.find()) {
            return ext.group(1).trim();
        }
        return subject.trim();
    }

    private static Document readXml(String content) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            // NZB files carry a DOCTYPE, so it is tolerated but never fetched or expanded
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(content)));
        } catch (SAXException | IOException ex) {
            throw AnalysisException.malformed("Invalid NZB XML: " + ex.getMessage());
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser misconfigured", ex);
        }
    }

    private static List<String> texts(Element parent, String tag) {
        List<String> values = new ArrayList<>();
        NodeList nodes = parent.getElementsByTagNameNS("*", tag);
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            String text = node.getTextContent();
            if (text != null && !text.isBlank()) {
                values.add(text.trim());
            }
        }
        return values;
    }

    private static String localName(Element element) {
        return element.getLocalName() != null ? element.getLocalName() : element.getTagName();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
