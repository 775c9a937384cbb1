package com.phillippitts.mathpreserve.util;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.util.Locale;

/** Parsing and serialization of rendered markup with stable, non-reformatting output. */
public final class Markup {
    private Markup() {}

    /**
     * Parses markup as HTML. Fragments are parsed in body context, so leading head-only elements
     * such as {@code <link>} or {@code <style>} stay in the body and survive serialization.
     */
    public static Document parse(String html) {
        String markup = html == null ? "" : html;
        Document doc = isDocument(markup) ? Jsoup.parse(markup) : Jsoup.parseBodyFragment(markup);
        doc.outputSettings().prettyPrint(false);
        return doc;
    }

    /**
     * Serializes the document in the same shape it was given: a full document when the original
     * markup declared one, the body content otherwise.
     */
    public static String serialize(Document doc, String original) {
        if (original != null && isDocument(original)) {
            return doc.outerHtml();
        }
        return doc.body().html();
    }

    private static boolean isDocument(String markup) {
        return markup.toLowerCase(Locale.ROOT).contains("<html");
    }
}
