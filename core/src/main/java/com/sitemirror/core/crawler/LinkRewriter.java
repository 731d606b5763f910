package com.sitemirror.core.crawler;

import com.sitemirror.core.model.UrlMap;
import com.sitemirror.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.nio.charset.StandardCharsets;

/**
 * 오프라인 열람용 링크 재작성 (순수 함수, I/O 없음).
 *
 * a[href] 처리:
 * - UrlMap에 있는 URL   → 로컬 경로(pages/x.html) + 원래 fragment
 * - 같은 도메인, 미수집  → 절대 URL
 * - 다른 도메인          → 절대 URL + target=_blank, rel="noopener noreferrer"
 * - 이미 로컬 경로이거나 http(s)가 아닌 링크(mailto:, tel:, javascript:)는 그대로
 * - "#top" 같은 페이지 내 앵커도 base 변경 때문에 자기 로컬 경로 + fragment로 바뀐다
 *
 * 리소스(img/script/link/source/iframe)는 절대 URL로 바꿔 원 사이트에서 로드한다.
 * 로컬 경로가 출력 루트 기준이므로 &lt;base href="../"&gt;를 넣는다. 같은 UrlMap으로 두 번 적용해도 결과가 같다.
 */
public final class LinkRewriter {

    static final String BASE_HREF = "../";

    public String rewrite(String html, UrlMap urlMap, String pageUrl) {
        return rewrite(html, urlMap, pageUrl, UrlUtils.hostOf(pageUrl));
    }

    /**
     * @param pageUrl  상대 링크 해석 기준(리다이렉트 최종 URL)
     * @param siteHost 크롤 대상 호스트. 이 호스트가 아닌 링크만 외부로 본다
     */
    public String rewrite(String html, UrlMap urlMap, String pageUrl, String siteHost) {
        Document doc = Jsoup.parse(html == null ? "" : html, pageUrl);

        for (Element a : doc.select("a[href]")) {
            rewriteAnchor(a, urlMap, siteHost);
        }
        absolutize(doc.select("img[src], script[src], source[src], iframe[src]"), "src");
        absolutize(doc.select("link[href]"), "href");

        resetBase(doc);
        doc.select("meta[http-equiv=content-type]").remove();   // UTF-8로 다시 쓰므로 원래 선언 제거
        doc.charset(StandardCharsets.UTF_8);
        doc.outputSettings().prettyPrint(false);
        return doc.outerHtml();
    }

    private static void rewriteAnchor(Element a, UrlMap urlMap, String siteHost) {
        String href = a.attr("href").trim();
        if (href.isEmpty()) return;
        if (urlMap.isLocalPath(UrlUtils.stripFragment(href))) return;   // 이미 재작성됨

        String abs = a.absUrl("href");
        if (!UrlUtils.isHttp(abs)) return;

        String fragment = UrlUtils.fragmentOf(abs);
        String local = urlMap.get(UrlUtils.stripFragment(abs));
        if (local != null) {
            a.attr("href", local + fragment);
            return;
        }

        a.attr("href", abs);
        if (!siteHost.equalsIgnoreCase(UrlUtils.hostOf(abs))) {
            a.attr("target", "_blank");
            a.attr("rel", "noopener noreferrer");
        }
    }

    private static void absolutize(Elements els, String attr) {
        for (Element e : els) {
            String abs = e.absUrl(attr);
            if (!abs.isEmpty()) e.attr(attr, abs);
        }
    }

    /** 기존 base 제거 후 head 맨 앞에 base href="../" 하나만 둔다 */
    private static void resetBase(Document doc) {
        Elements bases = doc.select("base");
        if (bases.size() == 1 && BASE_HREF.equals(bases.first().attr("href"))
                && bases.first().parent() == doc.head() && bases.first().elementSiblingIndex() == 0) {
            return;
        }
        bases.remove();
        doc.head().prependElement("base").attr("href", BASE_HREF);
    }
}
