/*
 * PDF-Auto-Redact - PDF Structure Analysis and Redaction
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
package net.boyechko.pdf.autoredact.analysis;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import net.boyechko.pdf.autoredact.document.Box;
import net.boyechko.pdf.autoredact.document.EngineDocument;
import net.boyechko.pdf.autoredact.document.LayoutBlock;
import net.boyechko.pdf.autoredact.document.PageDimensions;
import net.boyechko.pdf.autoredact.document.TextLine;
import net.boyechko.pdf.autoredact.document.TextSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the raw fragments of a page into {@link Block}s.
 *
 * <p>Images come from the engine's image list and from image-typed layout blocks; an image seen
 * on both paths is reported once. Text layout blocks are merged into one block each, with font
 * attributes decided by character-weighted majority.
 */
public final class BlockExtractor {
    private static final Logger logger = LoggerFactory.getLogger(BlockExtractor.class);

    /** Images narrower or shorter than this are decorative. */
    static final double MIN_IMAGE_SIZE = 20.0;

    private static final int ID_TEXT_PREFIX = 50;
    private static final int ID_LENGTH = 12;

    private final RegionClassifier regionClassifier;

    public BlockExtractor(RegionClassifier regionClassifier) {
        this.regionClassifier = regionClassifier;
    }

    public BlockExtractor() {
        this(new RegionClassifier());
    }

    /** Extracts the blocks of a 0-based page of an open document. */
    public List<Block> extractPage(EngineDocument doc, int page) {
        PageDimensions dims = doc.pageDimensions(page);
        List<Box> imageBoxes = doc.extractImageBoxes(page);
        List<LayoutBlock> layout = doc.extractFragments(page);
        List<Block> blocks = extractPage(page, dims.height(), imageBoxes, layout);
        logger.debug(
                "Page {}: {} layout blocks, {} images -> {} blocks",
                page,
                layout.size(),
                imageBoxes.size(),
                blocks.size());
        return blocks;
    }

    List<Block> extractPage(
            int page, double pageHeight, List<Box> imageBoxes, List<LayoutBlock> layout) {
        List<Block> blocks = new ArrayList<>();
        Set<Box> seenImages = new HashSet<>();

        for (Box box : imageBoxes) {
            if (isDecorative(box) || !seenImages.add(box.rounded())) {
                continue;
            }
            String id = hash(page + ":img:" + coords(box));
            blocks.add(imageBlock(id, page, box));
        }

        for (int index = 0; index < layout.size(); index++) {
            LayoutBlock fragment = layout.get(index);
            if (fragment.isImage()) {
                Box box = fragment.bbox();
                if (isDecorative(box) || !seenImages.add(box.rounded())) {
                    continue;
                }
                String id = hash(page + ":img:" + index + ":" + coords(box));
                blocks.add(imageBlock(id, page, box));
                continue;
            }
            Block text = textBlock(page, index, pageHeight, fragment);
            if (text != null) {
                blocks.add(text);
            }
        }
        return blocks;
    }

    private Block textBlock(int page, int index, double pageHeight, LayoutBlock fragment) {
        List<String> parts = new ArrayList<>();
        Map<Double, Integer> charsBySize = new LinkedHashMap<>();
        Map<String, Integer> charsByFont = new LinkedHashMap<>();
        int totalChars = 0;
        int boldChars = 0;
        int italicChars = 0;
        int superscriptChars = 0;

        for (TextLine line : fragment.lines()) {
            for (TextSpan span : line.spans()) {
                String text = span.text();
                if (text.isBlank()) {
                    continue;
                }
                parts.add(text);
                int length = text.length();
                totalChars += length;
                charsBySize.merge(Hashes.round1(span.size()), length, Integer::sum);
                charsByFont.merge(span.fontName(), length, Integer::sum);

                String font = span.fontName().toLowerCase(Locale.ROOT);
                if (font.contains("bold") || span.hasFlag(TextSpan.BOLD)) {
                    boldChars += length;
                }
                if (font.contains("italic")
                        || font.contains("oblique")
                        || span.hasFlag(TextSpan.ITALIC)) {
                    italicChars += length;
                }
                if (span.hasFlag(TextSpan.SUPERSCRIPT)) {
                    superscriptChars += length;
                }
            }
        }

        String text = String.join(" ", parts);
        if (text.isBlank()) {
            return null;
        }

        Box box = fragment.bbox();
        int lineCount = fragment.lines().size();
        Region region = regionClassifier.classify(box.y0(), text.length(), lineCount, pageHeight);
        String prefix = text.length() > ID_TEXT_PREFIX ? text.substring(0, ID_TEXT_PREFIX) : text;

        return Block.builder(hash(page + ":" + index + ":" + prefix))
                .page(page)
                .bounds(box.x0(), box.y0(), box.width(), box.height())
                .text(text)
                .font(dominant(charsBySize, 10.0), dominant(charsByFont, "unknown"))
                .lineCount(lineCount)
                .region(region)
                .bold(boldChars > totalChars * 0.5)
                .italic(italicChars > totalChars * 0.5)
                .superscript(superscriptChars > totalChars * 0.5)
                .build();
    }

    private static Block imageBlock(String id, int page, Box box) {
        return Block.builder(id)
                .page(page)
                .bounds(box.x0(), box.y0(), box.width(), box.height())
                .text("[Image " + (int) box.width() + "x" + (int) box.height() + "]")
                .charCount(0)
                .font(0, "image")
                .lineCount(0)
                .region(Region.BODY)
                .image(true)
                .build();
    }

    /** First key with the highest count, in insertion order. */
    private static <K> K dominant(Map<K, Integer> counts, K fallback) {
        K best = fallback;
        int bestCount = -1;
        for (Map.Entry<K, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    private static boolean isDecorative(Box box) {
        return box.width() < MIN_IMAGE_SIZE || box.height() < MIN_IMAGE_SIZE;
    }

    private static String coords(Box box) {
        return String.format(Locale.ROOT, "%.0f,%.0f", box.x0(), box.y0());
    }

    private static String hash(String key) {
        return Hashes.md5Prefix(key, ID_LENGTH);
    }
}
