package com.pageanalyzer.core.html;

import com.pageanalyzer.core.util.TextUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 본문 추출 (readability 류 휴리스틱).
 *
 * 1) script/style/nav/footer/aside 등 잡음 영역 제거, 보일러플레이트 class/id 제거
 * 2) 문단(p/pre/blockquote/td) 점수를 부모(전부)/조부모(절반)에 누적
 * 3) 후보 점수 = (문단 점수 + 태그 보너스 + class 가중치) x (1 - 링크 밀도) x 텍스트 밀도 계수
 * 4) 최고 후보 + 점수가 충분한 형제 블록을 본문으로 채택
 *
 * 원본 문서는 변경하지 않는다 (clone 위에서 작업).
 */
public final class MainContentExtractor {

    /** 본문 텍스트 + 버려진 텍스트 비율 */
    public record Extraction(String text, double boilerplateRatio) {
        public static final Extraction EMPTY = new Extraction(null, 1.0);

        public boolean isEmpty() {
            return text == null || text.isBlank();
        }
    }

    private static final String NOISE_TAGS =
            "script, style, noscript, template, iframe, svg, canvas, form, button, select, nav, footer, aside, header, menu, dialog";

    private static final Pattern UNLIKELY = Pattern.compile(
            "(?i)banner|breadcrumb|combx|comment|community|cookie|disqus|extra|foot|header|menu|modal|nav|"
                    + "newsletter|pager|popup|promo|related|remark|rss|share|shoutbox|sidebar|skyscraper|social|"
                    + "sponsor|subscribe|ad-break|advert|agegate|pagination|widget");
    private static final Pattern LIKELY = Pattern.compile(
            "(?i)and|article|body|column|content|entry|hentry|main|page|post|story|text|blog");
    private static final Pattern POSITIVE = Pattern.compile(
            "(?i)article|body|content|entry|hentry|h-entry|main|page|post|text|blog|story");
    private static final Pattern NEGATIVE = Pattern.compile(
            "(?i)hidden|banner|combx|comment|com-|contact|foot|footer|footnote|masthead|media|meta|outbrain|"
                    + "promo|related|scroll|share|shoutbox|sidebar|skyscraper|sponsor|shopping|tags|tool|widget|ad-");

    private static final int MIN_PARAGRAPH_CHARS = 25;

    private MainContentExtractor() {}

    public static Extraction extract(Document source) {
        if (source == null || source.body() == null) return Extraction.EMPTY;

        Document doc = source.clone();
        Element body = doc.body();
        int totalChars = textLength(body);
        if (totalChars == 0) return Extraction.EMPTY;

        doc.select(NOISE_TAGS).remove();
        removeUnlikely(body);

        Map<Element, Double> scores = scoreCandidates(body);
        Element best = pickBest(scores);

        String text;
        if (best == null) {
            // 문단이 없는 페이지: article/main → body 전체 텍스트
            Element container = body.selectFirst("article, main, [role=main]");
            text = TextUtils.blankToNull((container != null ? container : body).text());
        } else {
            text = collect(best, scores);
        }
        if (text == null) return Extraction.EMPTY;

        double ratio = 1.0 - Math.min(1.0, text.length() / (double) totalChars);
        return new Extraction(text, ratio);
    }

    // ---------- 1) 잡음 제거 ----------
    private static void removeUnlikely(Element body) {
        List<Element> doomed = new ArrayList<>();
        for (Element el : body.getAllElements()) {
            if (el == body) continue;
            String tag = el.normalName();
            if (tag.equals("article") || tag.equals("main") || tag.equals("html")) continue;
            String sig = el.className() + " " + el.id();
            if (sig.isBlank()) continue;
            if (UNLIKELY.matcher(sig).find() && !LIKELY.matcher(sig).find()
                    && el.selectFirst("article, main") == null) {
                doomed.add(el);
            }
        }
        for (Element el : doomed) {
            if (el.parent() != null) el.remove();
        }
    }

    // ---------- 2~3) 후보 점수 ----------
    private static Map<Element, Double> scoreCandidates(Element body) {
        Map<Element, Double> scores = new IdentityHashMap<>();
        Elements paragraphs = body.select("p, pre, blockquote, td");
        for (Element p : paragraphs) {
            String t = p.text();
            if (t.length() < MIN_PARAGRAPH_CHARS) continue;

            double pScore = 1.0 + countCommas(t) + Math.min(3.0, t.length() / 100.0);

            Element parent = p.parent();
            if (parent == null) continue;
            scores.merge(parent, initialScore(parent) + pScore, (a, b) -> a + pScore);

            Element grand = parent.parent();
            if (grand != null && grand.normalName() != null && !grand.normalName().equals("#root")) {
                scores.merge(grand, initialScore(grand) + pScore / 2.0, (a, b) -> a + pScore / 2.0);
            }
        }
        // 링크 밀도 / 텍스트 밀도 반영
        for (Map.Entry<Element, Double> e : scores.entrySet()) {
            Element el = e.getKey();
            double adjusted = e.getValue() * (1.0 - linkDensity(el)) * densityFactor(el);
            e.setValue(adjusted);
        }
        return scores;
    }

    private static double initialScore(Element el) {
        double s = switch (el.normalName()) {
            case "article", "main" -> 10.0;
            case "div" -> 5.0;
            case "pre", "td", "blockquote", "section" -> 3.0;
            case "address", "ol", "ul", "dl", "dd", "dt", "li", "form" -> -3.0;
            case "h1", "h2", "h3", "h4", "h5", "h6", "th" -> -5.0;
            default -> 0.0;
        };
        if ("main".equalsIgnoreCase(el.attr("role"))) s += 5.0;
        return s + classWeight(el);
    }

    private static double classWeight(Element el) {
        double w = 0;
        String cls = el.className();
        String id = el.id();
        if (!cls.isEmpty()) {
            if (NEGATIVE.matcher(cls).find()) w -= 25;
            if (POSITIVE.matcher(cls).find()) w += 25;
        }
        if (!id.isEmpty()) {
            if (NEGATIVE.matcher(id).find()) w -= 25;
            if (POSITIVE.matcher(id).find()) w += 25;
        }
        return w;
    }

    /** 링크 안 텍스트 / 전체 텍스트 */
    static double linkDensity(Element el) {
        int total = textLength(el);
        if (total == 0) return 0.0;
        int linked = 0;
        for (Element a : el.select("a")) linked += a.text().length();
        return Math.min(1.0, linked / (double) total);
    }

    /** 텍스트 길이 / (1 + 하위 태그 수) 를 0.5..1.0 계수로 */
    static double densityFactor(Element el) {
        int tags = el.getAllElements().size() - 1;
        double density = textLength(el) / (1.0 + tags);
        return 0.5 + 0.5 * Math.min(1.0, density / 80.0);
    }

    private static Element pickBest(Map<Element, Double> scores) {
        Element best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Map.Entry<Element, Double> e : scores.entrySet()) {
            if (e.getValue() > bestScore) {
                best = e.getKey();
                bestScore = e.getValue();
            }
        }
        return best;
    }

    // ---------- 4) 본문 조립 ----------
    private static String collect(Element best, Map<Element, Double> scores) {
        double bestScore = scores.getOrDefault(best, 0.0);
        double threshold = Math.max(10.0, bestScore * 0.2);

        Element parent = best.parent();
        List<Element> picked = new ArrayList<>();
        if (parent == null) {
            picked.add(best);
        } else {
            for (Element sib : parent.children()) {
                if (sib == best) {
                    picked.add(sib);
                    continue;
                }
                Double s = scores.get(sib);
                if (s != null && s >= threshold) {
                    picked.add(sib);
                } else if (sib.normalName().equals("p")) {
                    String t = sib.text();
                    if (t.length() > 80 && linkDensity(sib) < 0.25) picked.add(sib);
                }
            }
        }

        List<String> blocks = new ArrayList<>();
        for (Element el : picked) {
            String t = TextUtils.blankToNull(el.text());
            if (t != null) blocks.add(t);
        }
        return blocks.isEmpty() ? null : String.join("\n\n", blocks);
    }

    private static int textLength(Element el) {
        return el == null ? 0 : el.text().length();
    }

    private static int countCommas(String t) {
        int n = 0;
        for (int i = 0; i < t.length(); i++) if (t.charAt(i) == ',') n++;
        return n;
    }
}
