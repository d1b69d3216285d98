package com.crossstitch.publisher.application.artifact;

import java.util.ArrayList;
import java.util.List;

/**
 * Object storage key layout for published artifacts.
 *
 * <p>Album ids are printed unpadded; the chart key pads the design id to 5 digits.</p>
 */
public final class ArtifactKeys {
  public static final String PDF_PREFIX = "pdfs/";

  private ArtifactKeys() {}

  /** {@code charts/00012_Title.scc} */
  public static String chartKey(int designId, String title, String extension) {
    return String.format("charts/%05d_%s.%s", designId, title == null ? "" : title, extension);
  }

  /** {@code pdfs/7/12/Stitch12_3_Kit.pdf} */
  public static String variantKey(int albumId, int designId, String variant) {
    return PDF_PREFIX + albumId + "/" + designId + "/Stitch" + designId + "_" + variant + "_Kit.pdf";
  }

  /** {@code pdfs/7/Stitch12_Kit.pdf}, a copy of variant 1 kept for old download links. */
  public static String legacyKey(int albumId, int designId) {
    return PDF_PREFIX + albumId + "/Stitch" + designId + "_Kit.pdf";
  }

  /** {@code photos/7/12/4.jpg} */
  public static String photoKey(String photoPrefix, int albumId, int designId, String fileName) {
    return photoPrefix + "/" + albumId + "/" + designId + "/" + fileName;
  }

  /**
   * Lists every PDF key a published design is expected to have.
   *
   * @param albumId album id
   * @param designId design id
   * @param variants PDF variants
   * @return variant keys followed by the legacy key
   */
  public static List<String> expectedPdfKeys(int albumId, int designId, List<String> variants) {
    List<String> keys = new ArrayList<>(variants.size() + 1);
    for (String variant : variants) {
      keys.add(variantKey(albumId, designId, variant));
    }
    keys.add(legacyKey(albumId, designId));
    return keys;
  }
}
