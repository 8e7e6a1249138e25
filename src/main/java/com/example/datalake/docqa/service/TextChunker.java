package com.example.datalake.docqa.service;

import com.example.datalake.docqa.config.RagProperties;
import com.example.datalake.docqa.model.ChunkDraft;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits extracted text into overlapping passages.
 *
 * <p>Prose is split into sentence-like units on {@code . ! ?} and line breaks, then packed greedily
 * into chunks of at most {@code maxSize} characters. Each new chunk starts with the last
 * {@code overlap / 5} words of the previous one. A single unit longer than {@code maxSize} is kept
 * whole. Spreadsheet text ({@code === SHEET: name ===} sections) is chunked per sheet with the sheet
 * header and {@code COLUMNS:} line repeated at the top of every chunk.
 */
@Component
@RequiredArgsConstructor
public class TextChunker {

  static final String SHEET_MARKER = "=== SHEET:";
  private static final String COLUMNS_MARKER = "COLUMNS:";
  private static final String ROW_PREFIX = "ROW";
  private static final int HEADER_SCAN_LINES = 5;

  private static final Pattern SENTENCE = Pattern.compile("[^.!?\\n]+(?:[.!?\\n]+|$)");
  private static final Pattern SHEET_SPLIT = Pattern.compile("(?=" + Pattern.quote(SHEET_MARKER) + ")");
  private static final Pattern SEPARATOR_LINE = Pattern.compile("^=+$");
  private static final Pattern SHEET_NAME = Pattern.compile("=== SHEET:\\s*(.*?)\\s*===");

  private final RagProperties properties;

  public List<String> chunk(String text) {
    RagProperties.Chunking cfg = properties.getChunking();
    return chunk(text, cfg.getMaxSize(), cfg.getOverlap());
  }

  /** Chunks with their 0-based index and, for spreadsheets, the sheet name as metadata. */
  public List<ChunkDraft> toDrafts(String text) {
    List<String> chunks = chunk(text);
    List<ChunkDraft> drafts = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      String content = chunks.get(i);
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("length", content.length());
      Matcher sheet = SHEET_NAME.matcher(content);
      if (content.startsWith(SHEET_MARKER) && sheet.find()) {
        metadata.put("sheet", sheet.group(1));
      }
      drafts.add(new ChunkDraft(i, content, metadata));
    }
    return drafts;
  }

  public static List<String> chunk(String text, int maxSize, int overlap) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be positive");
    }
    if (text == null || text.isBlank()) {
      return List.of();
    }
    String trimmed = text.trim();
    if (trimmed.length() <= maxSize) {
      return List.of(trimmed);
    }
    if (trimmed.contains(SHEET_MARKER)) {
      return chunkSpreadsheet(trimmed, maxSize);
    }
    return chunkProse(trimmed, maxSize, Math.max(0, overlap) / 5);
  }

  private static List<String> chunkProse(String text, int maxSize, int overlapWords) {
    List<String> chunks = new ArrayList<>();
    StringBuilder buffer = new StringBuilder();

    Matcher matcher = SENTENCE.matcher(text);
    while (matcher.find()) {
      String unit = matcher.group().trim();
      if (unit.isEmpty()) {
        continue;
      }
      if (buffer.length() > 0 && buffer.length() + 1 + unit.length() > maxSize) {
        String emitted = buffer.toString().trim();
        chunks.add(emitted);
        buffer.setLength(0);
        String carry = lastWords(emitted, overlapWords);
        if (!carry.isEmpty()) {
          buffer.append(carry).append(' ');
        }
        buffer.append(unit);
      } else {
        if (buffer.length() > 0) {
          buffer.append(' ');
        }
        buffer.append(unit);
      }
    }

    String tail = buffer.toString().trim();
    if (!tail.isEmpty()) {
      chunks.add(tail);
    }
    return chunks;
  }

  private static String lastWords(String chunk, int count) {
    if (count <= 0) {
      return "";
    }
    String[] words = chunk.split("\\s+");
    int from = Math.max(0, words.length - count);
    return String.join(" ", Arrays.copyOfRange(words, from, words.length));
  }

  private static List<String> chunkSpreadsheet(String text, int maxSize) {
    List<String> chunks = new ArrayList<>();
    for (String section : SHEET_SPLIT.split(text)) {
      if (section.isBlank()) {
        continue;
      }
      List<String> lines = section.lines()
          .filter(l -> !l.isBlank())
          .toList();

      String sheetHeader = "";
      String columns = "";
      int dataStart = 0;
      for (int i = 0; i < Math.min(lines.size(), HEADER_SCAN_LINES); i++) {
        String line = lines.get(i);
        if (line.contains(SHEET_MARKER)) {
          sheetHeader = line.trim();
          dataStart = i + 1;
        } else if (line.contains(COLUMNS_MARKER)) {
          columns = line.trim();
          dataStart = Math.max(dataStart, i + 1);
        } else if (line.contains("===")) {
          dataStart = Math.max(dataStart, i + 1);
        }
      }
      while (dataStart < lines.size() && SEPARATOR_LINE.matcher(lines.get(dataStart).trim()).matches()) {
        dataStart++;
      }

      String header = sheetHeader + "\n" + columns + "\n";
      StringBuilder current = new StringBuilder(header);
      int rows = 0;
      for (String line : lines.subList(dataStart, lines.size())) {
        if (line.startsWith(ROW_PREFIX) && rows > 0 && current.length() + line.length() > maxSize) {
          chunks.add(current.toString().trim());
          current.setLength(0);
          current.append(header);
          rows = 0;
        }
        current.append(line).append('\n');
        if (line.startsWith(ROW_PREFIX)) {
          rows++;
        }
      }

      String last = current.toString().trim();
      if (last.length() > sheetHeader.length() + columns.length() + 1) {
        chunks.add(last);
      }
    }
    return chunks.stream().filter(c -> !c.isBlank()).toList();
  }
}
