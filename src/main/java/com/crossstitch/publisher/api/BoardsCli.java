package com.crossstitch.publisher.api;

import com.crossstitch.publisher.application.boards.BoardProvisioningUseCase;
import com.crossstitch.publisher.config.BoardsConfig;
import com.crossstitch.publisher.domain.design.AlbumRecord;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for pinboard maintenance: creating one board per album, or renaming boards for search.
 *
 * @since 0.1.0
 */
public final class BoardsCli {
  private static final Logger log = LoggerFactory.getLogger(BoardsCli.class);
  private static final Map<String, String> FLAG_KEYS = Map.of("--dry-run", "dryRun");
  private static final String SUMMARY_USAGE =
      "usage: boards action=create|rename [csv=PATH] [config=PATH] [--dry-run]";
  private static final String HELP_TEXT = """
      Pinboard maintenance

      Usage:
        boards action=create csv=AlbumBoards.csv
        boards action=rename csv=AlbumBoards.csv

      Actions:
        create   Create a board for every album in the catalog and write the CSV (AlbumID,AlbumCaption,BoardID)
        rename   Rename and describe every board listed in the CSV

      Optional:
        csv=PATH                    Board CSV (default pinterest.boardsCsv)
        pinterest.accessToken=TOKEN Access token; falls back to PINTEREST_ACCESS_TOKEN
        --dry-run                   Report what would change without calling the pinboard service
        --verbose                   Enable DEBUG logging
        --help                      Show this message
      """;

  private BoardsCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CommandSupport.Prepared prepared =
        CommandSupport.prepare("boards", args, HELP_TEXT, SUMMARY_USAGE, FLAG_KEYS, log);
    if (prepared.finished()) {
      return prepared.exit();
    }

    BoardsConfig config;
    try {
      config = BoardsConfig.fromMap(prepared.config());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid boards arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    return CommandSupport.execute("boards", prepared.metricsExporter(), log, root -> {
      BoardProvisioningUseCase useCase = root.boardProvisioning(config);
      switch (config.action()) {
        case CREATE -> {
          List<AlbumRecord> albums = useCase.createBoards(config.csv(), config.dryRun());
          CliPrinter.println((config.dryRun() ? "Would create " : "Created ") + albums.size()
              + " board(s)" + (config.dryRun() ? "" : "; CSV written to " + config.csv()));
        }
        case RENAME -> {
          int renamed = useCase.renameBoards(config.csv(), config.dryRun());
          CliPrinter.println((config.dryRun() ? "Would rename " : "Renamed ") + renamed + " board(s)");
        }
      }
      return ExitCode.SUCCESS;
    });
  }
}
