package com.jimin.feedreader.service;

import com.jimin.feedreader.client.FeedHttpClient;
import com.jimin.feedreader.client.FetchResponse;
import com.jimin.feedreader.dto.ParseResult;
import com.jimin.feedreader.dto.RawEntry;
import com.jimin.feedreader.exception.FeedTransportException;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jdom2.Attribute;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.input.SAXBuilder;
import org.jdom2.input.sax.XMLReaders;
import org.jsoup.Jsoup;
import org.jsoup.nodes.DocumentType;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.Node;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * RSS/Atom 피드 파서 (Rome 어댑터)
 *
 * 동작 방식:
 * 1. 바이트 → 문자열 (Rome XmlReader가 BOM, XML 선언, HTTP charset으로 인코딩 판별)
 * 2. 엄격한 XML 파싱 (DOCTYPE 금지, 외부 엔티티 미확장)
 * 3. 실패하면 jsoup XML 파서로 복구 후 한 번 더 파싱 → 성공 시 TOLERATED
 * 4. Rome SyndFeedInput으로 RSS 0.9x/1.0/2.0, Atom 0.3/1.0 변환
 * 5. 항목마다 RawEntry(key/value 뷰) 생성, 원문 순서 유지
 *
 * 잘못된 입력에도 예외를 던지지 않고 FAILED 결과를 반환함
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FeedParser {

    private static final String DISALLOW_DOCTYPE = "http://apache.org/xml/features/disallow-doctype-decl";

    private final FeedHttpClient httpClient;

    /**
     * URL에서 직접 fetch 후 파싱
     */
    public ParseResult parse(String url) {
        FetchResponse response;
        try {
            response = httpClient.get(url);
        } catch (FeedTransportException e) {
            log.warn("피드 fetch 실패: {} - {} ({})", url, e.getReason(), e.getMessage());
            return ParseResult.transportFailed(e);
        } catch (IllegalArgumentException e) {
            return ParseResult.failed("URL is not well-formed: " + e.getMessage());
        }
        return parse(response.body(), response.contentType());
    }

    /**
     * 이미 가져온 바이트를 파싱 (인코딩은 문서에서 판별)
     */
    public ParseResult parse(byte[] body) {
        return parse(body, null);
    }

    /**
     * 이미 가져온 바이트를 파싱
     *
     * @param body        피드 문서
     * @param contentType HTTP Content-Type (charset 판별용, 없으면 null)
     */
    public ParseResult parse(byte[] body, String contentType) {
        if (body == null || body.length == 0) {
            return ParseResult.failed("empty document");
        }

        try {
            String xml = decode(body, contentType);
            try {
                return toResult(buildDocument(xml), null);
            } catch (JDOMException | IOException strictError) {
                String diagnostic = "malformed XML: " + strictError.getMessage();
                log.debug("엄격한 파싱 실패, 복구 시도: {}", strictError.getMessage());
                try {
                    return toResult(buildDocument(repair(xml)), diagnostic);
                } catch (JDOMException | IOException repairError) {
                    return ParseResult.failed(diagnostic);
                }
            }
        } catch (IOException e) {
            return ParseResult.failed("unreadable document: " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("피드 파싱 중 예상하지 못한 오류", e);
            return ParseResult.failed("parse error: " + e.getMessage());
        }
    }

    private String decode(byte[] body, String contentType) throws IOException {
        ByteArrayInputStream in = new ByteArrayInputStream(body);
        try (XmlReader reader = contentType != null
                ? new XmlReader(in, contentType, true)
                : new XmlReader(in, true)) {
            StringWriter out = new StringWriter();
            reader.transferTo(out);
            return out.toString();
        }
    }

    private Document buildDocument(String xml) throws JDOMException, IOException {
        SAXBuilder builder = new SAXBuilder(XMLReaders.NONVALIDATING);
        builder.setFeature(DISALLOW_DOCTYPE, true);
        builder.setExpandEntities(false);
        return builder.build(new StringReader(xml));
    }

    /**
     * jsoup XML 파서로 깨진 XML 복구
     * 맨 & 이스케이프, 닫히지 않은 태그 닫기, DOCTYPE 제거
     */
    private String repair(String xml) {
        org.jsoup.nodes.Document document = Jsoup.parse(xml, "", Parser.xmlParser());
        List<Node> doctypes = document.childNodes().stream()
                .filter(DocumentType.class::isInstance)
                .toList();
        doctypes.forEach(Node::remove);

        document.outputSettings()
                .syntax(org.jsoup.nodes.Document.OutputSettings.Syntax.xml)
                .escapeMode(Entities.EscapeMode.xhtml)
                .charset(StandardCharsets.UTF_8)
                .prettyPrint(false);
        return document.outerHtml();
    }

    private ParseResult toResult(Document document, String diagnostic) {
        SyndFeed feed;
        try {
            feed = new SyndFeedInput(false, Locale.US).build(document);
        } catch (IllegalArgumentException e) {
            // Rome가 지원하지 않는 문서 (HTML 페이지 등)
            return ParseResult.failed("unsupported feed format");
        } catch (FeedException e) {
            return ParseResult.failed("invalid feed: " + e.getMessage());
        }

        boolean atom = feed.getFeedType() != null && feed.getFeedType().startsWith("atom");
        List<SyndEntry> entries = feed.getEntries();
        List<Element> elements = entryElements(document.getRootElement());
        if (elements.size() != entries.size()) {
            log.debug("항목 element 수({})와 Rome 항목 수({})가 다름, 원문 날짜 문자열 생략하고 id는 Rome uri 사용",
                    elements.size(), entries.size());
            elements = List.of();
        }

        List<RawEntry> rawEntries = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            Element element = elements.isEmpty() ? null : elements.get(i);
            rawEntries.add(toRawEntry(entries.get(i), element, atom));
        }

        if (diagnostic == null) {
            return ParseResult.clean(feed.getTitle(), rawEntries);
        }
        log.warn("깨진 XML을 복구해서 파싱함: {}", diagnostic);
        return ParseResult.tolerated(feed.getTitle(), rawEntries, diagnostic);
    }

    private RawEntry toRawEntry(SyndEntry entry, Element element, boolean atom) {
        List<String> contents = entry.getContents().stream()
                .map(SyndContent::getValue)
                .filter(Objects::nonNull)
                .toList();
        String description = entry.getDescription() != null ? entry.getDescription().getValue() : null;

        RawEntry.Builder builder = RawEntry.builder()
                .put(RawEntry.TITLE, entry.getTitle())
                .put(RawEntry.LINK, entry.getLink())
                .put(RawEntry.AUTHOR, blankToNull(entry.getAuthor()))
                .put(RawEntry.CONTENT, contents.isEmpty() ? null : contents)
                // Rome는 Atom summary와 RSS description을 모두 description으로 합침
                .put(atom ? RawEntry.SUMMARY : RawEntry.DESCRIPTION, description)
                .put(RawEntry.PUBLISHED_PARSED, entry.getPublishedDate())
                .put(RawEntry.UPDATED_PARSED, entry.getUpdatedDate());

        if (element != null) {
            builder.put(RawEntry.ID, idOf(element))
                    .put(RawEntry.PUBLISHED, childText(element, "pubDate", "published", "issued", "date"))
                    .put(RawEntry.UPDATED, childText(element, "updated", "modified"))
                    .put(RawEntry.CREATED, childText(element, "created"));
            if (entry.getLink() == null) {
                builder.put(RawEntry.LINK, childText(element, "link"));
            }
        } else {
            // Why: id가 빠지면 link가 guid가 되어 기존 항목과 식별자가 달라짐
            //      Rome uri = RSS guid / Atom id / rdf:about
            builder.put(RawEntry.ID, blankToNull(entry.getUri()));
        }
        return builder.build();
    }

    /**
     * RSS item / RDF item / Atom entry element 목록 (문서 순서)
     */
    private List<Element> entryElements(Element root) {
        String name = root.getName();
        if ("rss".equalsIgnoreCase(name)) {
            Element channel = firstChild(root, "channel");
            return channel == null ? List.of() : children(channel, "item");
        }
        if ("RDF".equals(name)) {
            return children(root, "item");
        }
        if ("feed".equals(name)) {
            return children(root, "entry");
        }
        return List.of();
    }

    private String idOf(Element element) {
        String id = childText(element, "guid", "id");
        if (id != null) {
            return id;
        }
        // RSS 1.0: <item rdf:about="...">
        for (Attribute attribute : element.getAttributes()) {
            if ("about".equals(attribute.getName())) {
                return blankToNull(attribute.getValue());
            }
        }
        return null;
    }

    private String childText(Element element, String... names) {
        for (String name : names) {
            Element child = firstChild(element, name);
            if (child != null) {
                String text = blankToNull(child.getTextTrim());
                if (text != null) {
                    return text;
                }
            }
        }
        return null;
    }

    // namespace 상관없이 local name으로 찾음 (dc:date 등)
    private Element firstChild(Element element, String name) {
        for (Element child : element.getChildren()) {
            if (name.equals(child.getName())) {
                return child;
            }
        }
        return null;
    }

    private List<Element> children(Element element, String name) {
        return element.getChildren().stream()
                .filter(child -> name.equals(child.getName()))
                .toList();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
