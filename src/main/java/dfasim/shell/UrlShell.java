package dfasim.shell;

import dfasim.codec.AutomatonCodec;
import dfasim.service.AutomatonService;
import dfasim.service.AutomatonStore;
import dfasim.service.UrlReport;
import dfasim.validate.AutomatonUrlValidator;
import dfasim.validate.SecurityIssue;
import dfasim.validate.UrlComponents;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shell which validates one URL per line until the user enters {@code q}.
 */
public final class UrlShell {

  private final BufferedReader in;
  private final PrintStream out;
  private final AutomatonService service;

  public UrlShell(BufferedReader in, PrintStream out, AutomatonService service) {
    this.in = in;
    this.out = out;
    this.service = service;
  }

  public static void main(String[] args) throws IOException {
    final ShellSettings settings = ShellSettings.load();
    final var service = new AutomatonService(
      new AutomatonStore(settings.storeDirectory(), new AutomatonCodec()),
      AutomatonUrlValidator.forUrlGrammar(settings.securityScanner())
    );
    final var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    new UrlShell(in, System.out, service).run();
  }

  public void run() throws IOException {
    out.println("URL Validator");
    out.println("=============");

    while (true) {
      out.print("\nEnter a URL to validate (or 'q' to quit): ");
      out.flush();
      final String line = in.readLine();
      if (line == null || line.trim().toLowerCase(Locale.ROOT).equals("q")) {
        return;
      }
      print(service.validateUrl(line.trim()));
    }
  }

  private void print(UrlReport report) {
    if (report.valid()) {
      out.println("Valid URL");
    } else {
      out.println("Invalid URL");
      out.println("Reason: " + report.rejectionReason());
    }
    out.println("State sequence: " + String.join(" -> ", report.stateSequence()));

    if (report.securityIssues().isEmpty()) {
      out.println("Security issues: none");
    } else {
      out.println("Security issues:");
      for (Map.Entry<SecurityIssue, List<String>> issue : report.securityIssues().entrySet()) {
        out.println("  " + issue.getKey().jsonName() + ": " + String.join(", ", issue.getValue()));
      }
    }

    final UrlComponents components = report.components();
    if (components != null) {
      out.println("Components:");
      out.println("  scheme: " + components.scheme());
      out.println("  authority: " + components.authority());
      out.println("  path: " + components.path());
      out.println("  query: " + components.query());
      out.println("  fragment: " + components.fragment());
    }
  }
}
