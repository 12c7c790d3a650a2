package textwikiMain;

import textwiki.WikiContext;
import textwiki.config.WikiConfig;
import textwiki.config.WikiConfigLoader;
import textwiki.errors.WikiException;
import textwiki.page.Page;
import textwiki.page.PageIndex;
import io.vertx.core.Vertx;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line access to a wiki directory.
 */
public final class WikiMain {
  private static final String USAGE =
    "Usage: [--root <dir>] [--markup markdown|text] [--config <file>] "
      + "index | tags | tag <tag> | search <term> | show <url> | move <url> <newUrl> | delete <url>";

  private WikiMain() {
  }

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    Map<String, String> params = new HashMap<>();
    List<String> command = new ArrayList<>();
    parseArgs(args, params, command);
    if (command.isEmpty()) {
      err.println(USAGE);
      return 2;
    }

    Vertx vertx = Vertx.vertx();
    try {
      WikiConfig config = WikiConfigLoader.load(vertx,
        params.getOrDefault("config", WikiConfigLoader.DEFAULT_FILE), WikiConfig.fromEnv());
      if (params.containsKey("root")) {
        config = config.withRootPath(params.get("root"));
      }
      if (params.containsKey("markup")) {
        config = config.withMarkup(params.get("markup"));
      }
      WikiContext context = WikiContext.create(vertx, config);
      return execute(context.pages(), command, out, err);
    } catch (WikiException | IllegalArgumentException e) {
      err.println("ERROR: " + e.getMessage());
      return 1;
    } finally {
      vertx.close();
    }
  }

  private static int execute(PageIndex pages, List<String> command, PrintStream out, PrintStream err) {
    String name = command.get(0);
    switch (name) {
      case "index":
        for (Page page : pages.index()) {
          out.println(page.url() + "\t" + page.attributeOrEmpty("title"));
        }
        return 0;
      case "tags":
        for (Map.Entry<String, List<Page>> entry : pages.getTags().entrySet()) {
          out.println(entry.getKey() + "\t" + entry.getValue().size());
        }
        return 0;
      case "tag":
        if (command.size() < 2) {
          break;
        }
        for (Page page : pages.indexByTag(command.get(1))) {
          out.println(page.url() + "\t" + page.attributeOrEmpty("title"));
        }
        return 0;
      case "search":
        if (command.size() < 2) {
          break;
        }
        for (Page page : pages.search(command.get(1))) {
          out.println(page.url() + "\t" + page.attributeOrEmpty("title"));
        }
        return 0;
      case "show":
        if (command.size() < 2) {
          break;
        }
        out.println(pages.getOr404(command.get(1)).cachedHtml());
        return 0;
      case "move":
        if (command.size() < 3) {
          break;
        }
        pages.move(command.get(1), command.get(2));
        out.println("Moved " + command.get(1) + " to " + command.get(2));
        return 0;
      case "delete":
        if (command.size() < 2) {
          break;
        }
        if (!pages.delete(command.get(1))) {
          err.println("No page at " + command.get(1));
          return 1;
        }
        out.println("Deleted " + command.get(1));
        return 0;
      default:
        break;
    }
    err.println(USAGE);
    return 2;
  }

  private static void parseArgs(String[] args, Map<String, String> params, List<String> command) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--")) {
        command.add(arg);
        continue;
      }
      String key = arg.substring(2);
      String value = (i + 1 < args.length && !args[i + 1].startsWith("--")) ? args[++i] : "true";
      params.put(key, value);
    }
  }
}
