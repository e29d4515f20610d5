package com.gentoro.wordhint.dictionary;

import com.gentoro.wordhint.exception.ConfigException;
import com.gentoro.wordhint.exception.DictionaryException;
import com.gentoro.wordhint.logging.LoggingService;
import com.gentoro.wordhint.solver.CandidateSet;
import com.gentoro.wordhint.solver.CandidateWord;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads the source word list. The location is either {@code classpath:<resource>}, a {@code file:}
 * URI or a plain filesystem path. The format is one word per line; lines are trimmed and
 * lowercased, and only lines of exactly {@link CandidateWord#WORD_LENGTH} letters {@code a-z} are
 * kept. A word listed twice is loaded twice and counts twice in letter frequencies.
 */
public class DictionaryLoader {
  private static final org.slf4j.Logger log = LoggingService.getLogger(DictionaryLoader.class);

  private static final String CLASSPATH_PREFIX = "classpath:";

  public static CandidateSet load(String location) {
    if (location == null || location.isBlank()) {
      throw new ConfigException("Missing dictionary.location config");
    }
    location = location.trim();
    log.trace("Resolving dictionary location: {}", location);

    if (location.startsWith(CLASSPATH_PREFIX)) {
      String resource = location.substring(CLASSPATH_PREFIX.length());
      if (resource.startsWith("/")) {
        resource = resource.substring(1);
      }
      if (resource.isBlank()) {
        throw new ConfigException("Invalid dictionary.location: classpath resource is empty");
      }
      ClassLoader cl = Thread.currentThread().getContextClassLoader();
      if (cl == null) cl = DictionaryLoader.class.getClassLoader();
      InputStream in = cl.getResourceAsStream(resource);
      if (in == null) {
        throw new DictionaryException("Classpath dictionary not found: " + location);
      }
      try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
        return load(reader, location);
      } catch (IOException e) {
        throw new DictionaryException("Failed to read dictionary " + location, e);
      }
    }

    Path path;
    try {
      path = location.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
    } catch (Exception e) {
      throw new ConfigException("Invalid dictionary.location URI/path: " + location, e);
    }
    if (!Files.isRegularFile(path)) {
      throw new DictionaryException("Dictionary file does not exist: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return load(reader, path.toString());
    } catch (IOException e) {
      throw new DictionaryException("Failed to read dictionary " + path, e);
    }
  }

  /**
   * Reads words from {@code reader}. The reader is not closed.
   *
   * @param sourceName used in log and error messages only
   */
  public static CandidateSet load(Reader reader, String sourceName) throws IOException {
    BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
    List<CandidateWord> words = new ArrayList<>();
    int skipped = 0;
    String line;
    while ((line = br.readLine()) != null) {
      String word = line.trim().toLowerCase(Locale.ROOT);
      if (isCandidate(word)) {
        words.add(new CandidateWord(word));
      } else if (!word.isEmpty()) {
        skipped++;
      }
    }
    if (words.isEmpty()) {
      throw new DictionaryException("Dictionary " + sourceName + " contains no usable words");
    }

    log.info("Loaded {} words from {} ({} lines skipped)", words.size(), sourceName, skipped);
    return new CandidateSet(words);
  }

  static boolean isCandidate(String word) {
    if (word.length() != CandidateWord.WORD_LENGTH) {
      return false;
    }
    for (int i = 0; i < word.length(); i++) {
      char c = word.charAt(i);
      if (c < 'a' || c > 'z') {
        return false;
      }
    }
    return true;
  }
}
