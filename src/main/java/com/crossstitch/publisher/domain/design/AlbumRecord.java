package com.crossstitch.publisher.domain.design;

import java.util.Objects;

/**
 * One album row of the board CSV.
 *
 * @param albumId 4-digit album id
 * @param caption album caption; may be empty
 * @param boardId pinboard board id; may be empty before the board is created
 * @since 0.1.0
 */
public record AlbumRecord(String albumId, String caption, String boardId) {

  public AlbumRecord {
    Objects.requireNonNull(albumId, "albumId");
    caption = caption == null ? "" : caption;
    boardId = boardId == null ? "" : boardId;
  }

  public AlbumRecord withBoardId(String newBoardId) {
    return new AlbumRecord(albumId, caption, newBoardId);
  }
}
