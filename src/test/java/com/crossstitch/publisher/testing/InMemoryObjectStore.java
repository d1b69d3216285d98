package com.crossstitch.publisher.testing;

import com.crossstitch.publisher.application.port.ObjectStorePort;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Object store double keeping uploaded bytes and content types in memory. */
public final class InMemoryObjectStore implements ObjectStorePort {
  private final Map<String, byte[]> objects = new TreeMap<>();
  private final Map<String, String> contentTypes = new TreeMap<>();
  private final List<String> putOrder = new ArrayList<>();
  private String failingKeyFragment;

  public InMemoryObjectStore failWhenKeyContains(String fragment) {
    this.failingKeyFragment = fragment;
    return this;
  }

  public InMemoryObjectStore seed(String... keys) {
    for (String key : keys) {
      objects.put(key, new byte[0]);
      contentTypes.put(key, "application/octet-stream");
    }
    return this;
  }

  @Override
  public void put(String key, Path file, String contentType) throws IOException {
    if (failingKeyFragment != null && key.contains(failingKeyFragment)) {
      throw new IOException("Injected upload failure for " + key);
    }
    objects.put(key, Files.readAllBytes(file));
    contentTypes.put(key, contentType);
    putOrder.add(key);
  }

  @Override
  public void delete(String key) {
    objects.remove(key);
    contentTypes.remove(key);
  }

  @Override
  public List<String> listKeys(String prefix) {
    return objects.keySet().stream().filter(key -> key.startsWith(prefix)).toList();
  }

  public boolean contains(String key) {
    return objects.containsKey(key);
  }

  public String contentType(String key) {
    return contentTypes.get(key);
  }

  public String content(String key) {
    byte[] bytes = objects.get(key);
    return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
  }

  public List<String> putOrder() {
    return List.copyOf(putOrder);
  }
}
