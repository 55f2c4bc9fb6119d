package cloud.aclinspector.cli;

import cloud.aclinspector.AclInspectorException;
import cloud.aclinspector.Config;
import cloud.aclinspector.CredentialException;
import cloud.aclinspector.DriveClient;
import cloud.aclinspector.DriveItem;
import cloud.aclinspector.MutationResult;
import cloud.aclinspector.Permission;
import cloud.aclinspector.PermissionEditor;
import cloud.aclinspector.RemovalPlan;
import cloud.aclinspector.StripResult;
import cloud.aclinspector.acl.UserMatch;
import cloud.aclinspector.auth.AuthorizationSession;
import cloud.aclinspector.auth.Capability;
import cloud.aclinspector.auth.CredentialStore;
import cloud.aclinspector.auth.LoopbackCallbackServer;
import cloud.aclinspector.auth.Token;
import cloud.aclinspector.auth.TokenResponse;
import cloud.aclinspector.report.AuditReport;
import cloud.aclinspector.report.AuditReportPrinter;
import cloud.aclinspector.report.JsonReportWriter;
import cloud.aclinspector.report.SharedItemsPrinter;
import cloud.aclinspector.scan.CollectingVisitor;
import cloud.aclinspector.scan.HierarchyScanner;
import cloud.aclinspector.scan.ItemType;
import cloud.aclinspector.scan.ScanOptions;
import cloud.aclinspector.scan.ScanStatistics;
import cloud.aclinspector.scan.SharedItem;
import cloud.aclinspector.scan.SharingFilterVisitor;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command-line entry point: {@code acl-inspector [PATH] [options]}.
 *
 * <p>
 * Without an action option the ACL of PATH (default {@code /}) is printed, optionally for the whole subtree. Exit
 * codes: 0 on success, 1 on failure, 2 on usage errors.
 * </p>
 */
public final class AclInspectorCli {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String ENV_CLIENT_ID = "ACL_INSPECTOR_CLIENT_ID";
    static final String ENV_CLIENT_SECRET = "ACL_INSPECTOR_CLIENT_SECRET";

    private static final Duration LOGIN_TIMEOUT = Duration.ofMinutes(5);
    private static final Logger ROOT_LOGGER = Logger.getLogger("cloud.aclinspector");

    private static final String ONLY_USER = "only-user";
    private static final String SHARED = "shared";
    private static final String REMOVE_USER = "remove-user";
    private static final String INVITE = "invite";
    private static final String STRIP_EXPLICIT = "strip-explicit";
    private static final String LOGIN = "login";
    private static final String RECURSIVE = "r";
    private static final String MAX_DEPTH = "max-depth";
    private static final String TYPE = "type";
    private static final String EXACT_USER = "exact-user";
    private static final String DRY_RUN = "dry-run";
    private static final String YES = "yes";
    private static final String READ_ONLY = "read-only";
    private static final String REMOTE = "remote";
    private static final String CONFIG = "config";
    private static final String JSON = "json";
    private static final String DEBUG = "debug";
    private static final String HELP = "h";

    private static final Options OPTIONS =
        new Options()
            .addOption(null, ONLY_USER, true, "List items USER has explicit access to")
            .addOption(null, SHARED, false, "List items shared by link or with users")
            .addOption(null, REMOVE_USER, true, "Remove USER's explicit access (destructive)")
            .addOption(null, INVITE, true, "Invite USER with read/write access (inherited by children)")
            .addOption(null, STRIP_EXPLICIT, false, "Remove every explicit permission of PATH (destructive)")
            .addOption(null, LOGIN, false, "Authorize in the browser and save a token with write access")
            .addOption(RECURSIVE, "recursive", false, "Include children in the scan (default depth: "
                + ScanOptions.DEFAULT_RECURSIVE_DEPTH + ")")
            .addOption(null, MAX_DEPTH, true, "Maximum depth (default: 3 with -r, 0 otherwise)")
            .addOption(null, TYPE, true, "Item type: folders|files|both (default: folders)")
            .addOption(null, EXACT_USER, false, "Match USER exactly instead of as a substring (with --only-user)")
            .addOption(null, DRY_RUN, false, "Preview changes (with --remove-user)")
            .addOption(null, YES, false, "Do not ask for confirmation (with --remove-user)")
            .addOption(null, READ_ONLY, false, "Grant read-only access (with --invite)")
            .addOption(null, REMOTE, true, "rclone remote to borrow a token from (default: auto-detect)")
            .addOption(null, CONFIG, true, "Properties file with connection settings")
            .addOption(null, JSON, false, "Write the result as JSON")
            .addOption(null, DEBUG, false, "Enable debug logging")
            .addOption(HELP, "help", false, "Displays help information");

    private final PrintStream out;
    private final PrintStream err;
    private final BufferedReader in;
    private final Map<String, String> env;

    public AclInspectorCli(PrintStream out, PrintStream err, InputStream in, Map<String, String> env) {
        this.out = out;
        this.err = err;
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.env = env;
    }

    public static void main(String[] args) {
        configureLogging();
        int code = new AclInspectorCli(System.out, System.err, System.in, System.getenv()).run(args);
        System.exit(code);
    }

    public int run(String[] args) {
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd;
        try {
            cmd = parser.parse(OPTIONS, args);
        } catch (ParseException e) {
            err.println("Error: " + e.getMessage());
            printHelp(err);
            return EXIT_USAGE;
        }

        if (cmd.hasOption(HELP)) {
            printHelp(out);
            return EXIT_OK;
        }
        if (cmd.hasOption(DEBUG)) {
            enableDebug();
        }

        String usageError = validate(cmd);
        if (usageError != null) {
            err.println("Error: " + usageError);
            return EXIT_USAGE;
        }

        int maxDepth;
        ItemType itemType;
        try {
            maxDepth = maxDepth(cmd);
            itemType = ItemType.parse(cmd.getOptionValue(TYPE, "folders"));
        } catch (IllegalArgumentException ex) {
            err.println("Error: " + ex.getMessage());
            return EXIT_USAGE;
        }

        Config config;
        try {
            config = loadConfig(cmd.getOptionValue(CONFIG));
        } catch (IOException | IllegalArgumentException ex) {
            err.println("Error: cannot load configuration: " + ex.getMessage());
            return EXIT_FAILURE;
        }

        String path = cmd.getArgs().length > 0 ? cmd.getArgs()[0] : "/";
        String remote = cmd.getOptionValue(REMOTE);
        CredentialStore store = new CredentialStore(config);

        try {
            if (cmd.hasOption(LOGIN)) {
                return login(store, config);
            }

            Capability required = requiresWrite(cmd) ? Capability.FULL : null;
            try (DriveClient client = new DriveClient(config, store.tokenProvider(remote, required, true))) {
                Token token = client.token();
                if (!cmd.hasOption(JSON)) {
                    out.printf(Locale.ROOT, "Using %s token (capability: %s)%n",
                        token.getSource().name().toLowerCase(Locale.ROOT), token.getCapability().label());
                }
                DriveItem item = client.itemByPath(path);
                ScanOptions options = new ScanOptions(maxDepth, itemType);

                if (cmd.hasOption(INVITE)) {
                    return invite(client, item, cmd.getOptionValue(INVITE), cmd.hasOption(READ_ONLY));
                }
                if (cmd.hasOption(STRIP_EXPLICIT)) {
                    return strip(client, item, path);
                }
                if (cmd.hasOption(REMOVE_USER)) {
                    return removeUser(client, item, path, cmd.getOptionValue(REMOVE_USER), options,
                        cmd.hasOption(DRY_RUN), cmd.hasOption(YES));
                }
                if (cmd.hasOption(ONLY_USER)) {
                    UserMatch match = cmd.hasOption(EXACT_USER) ? UserMatch.EXACT : UserMatch.SUBSTRING;
                    return sharedScan(client, item, path, cmd.getOptionValue(ONLY_USER), match, options,
                        cmd.hasOption(JSON));
                }
                if (cmd.hasOption(SHARED)) {
                    return sharedScan(client, item, path, null, UserMatch.SUBSTRING, options, cmd.hasOption(JSON));
                }
                return audit(client, item, path, options, cmd.hasOption(JSON));
            }
        } catch (CredentialException ex) {
            err.println("Error: " + ex.getMessage());
            if (!ex.getRemediation().isEmpty()) {
                err.println("To fix this: " + ex.getRemediation());
            }
            return EXIT_FAILURE;
        } catch (AclInspectorException ex) {
            err.println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (IOException ex) {
            err.println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int audit(DriveClient client, DriveItem item, String path, ScanOptions options, boolean json)
        throws AclInspectorException, IOException {
        if (options.maxDepth() > 0 && !json) {
            out.printf(Locale.ROOT, "Scanning folder hierarchy (max depth: %d)...%n", options.maxDepth());
        }
        CollectingVisitor visitor = new CollectingVisitor();
        ScanStatistics statistics = new HierarchyScanner(client).scan(item, path, options, visitor);
        if (options.maxDepth() > 0 && !json) {
            out.printf(Locale.ROOT, "Scan complete. Scanned %d item(s).%n", statistics.visited());
        }

        AuditReport report = AuditReport.build(path, visitor.collected(), options.maxDepth());
        if (json) {
            new JsonReportWriter(out).write(report);
        } else {
            new AuditReportPrinter(out).print(report);
        }
        return EXIT_OK;
    }

    private int sharedScan(
        DriveClient client,
        DriveItem item,
        String path,
        String user,
        UserMatch match,
        ScanOptions options,
        boolean json
    ) throws AclInspectorException, IOException {
        SharingFilterVisitor visitor = new SharingFilterVisitor(client, user, match);
        ScanStatistics statistics = new HierarchyScanner(client).scan(item, path, options, visitor);
        List<SharedItem> hits = visitor.hits();

        if (json) {
            new JsonReportWriter(out).write(hits, user, statistics);
            return EXIT_OK;
        }
        SharedItemsPrinter printer = new SharedItemsPrinter(out);
        if (user != null && options.maxDepth() == 0) {
            List<Permission> matches = hits.isEmpty() ? List.of() : hits.get(0).matchedPermissions();
            printer.printUserCheck(user, path, matches);
            return EXIT_OK;
        }
        printer.printStatistics(statistics);
        out.printf(Locale.ROOT, "%nScan complete. Checked %d item(s).%n", statistics.visited());
        printer.printHits(hits, user);
        return EXIT_OK;
    }

    private int invite(DriveClient client, DriveItem item, String user, boolean readOnly)
        throws AclInspectorException {
        String role = readOnly ? Permission.ROLE_READ : Permission.ROLE_WRITE;
        out.printf(Locale.ROOT, "Inviting %s to %s (%s)%n", user, item.name(), readOnly ? "read-only" : "read/write");
        MutationResult result = new PermissionEditor(client).invite(item.id(), user, role);
        if (!result.success()) {
            err.println("Error: " + result.message());
            return EXIT_FAILURE;
        }
        out.println(result.message());
        out.println("Note: this permission is inherited by all children of this item");
        return EXIT_OK;
    }

    private int strip(DriveClient client, DriveItem item, String path) throws AclInspectorException {
        StripResult result = new PermissionEditor(client).stripExplicit(item.id());
        if (result.complete()) {
            out.printf(Locale.ROOT, "Removed %d explicit permission(s) from %s%n", result.removedCount(), path);
            return EXIT_OK;
        }
        out.printf(Locale.ROOT, "Removed %d permission(s), %d failed%n", result.removedCount(), result.failedCount());
        return EXIT_FAILURE;
    }

    private int removeUser(
        DriveClient client,
        DriveItem item,
        String path,
        String user,
        ScanOptions options,
        boolean dryRun,
        boolean assumeYes
    ) throws AclInspectorException, IOException {
        PermissionEditor editor = new PermissionEditor(client);
        RemovalPlan plan = editor.planUserRemoval(item, path, user, options);
        if (plan.isEmpty()) {
            out.println("No items found with permissions for " + user);
            return EXIT_OK;
        }

        out.printf(Locale.ROOT, "Found %d permission(s) for %s:%n", plan.candidates().size(), user);
        for (RemovalPlan.Candidate candidate : plan.candidates()) {
            out.printf(Locale.ROOT, "  - %s (%s)%n", candidate.path(), candidate.role());
        }
        out.println();

        if (dryRun) {
            out.printf(Locale.ROOT, "DRY RUN: would remove %d permission(s)%n", plan.candidates().size());
            return EXIT_OK;
        }
        if (!assumeYes) {
            out.printf(Locale.ROOT, "This will remove %s's access from %d item(s).%n", user, plan.candidates().size());
            out.print("Continue? [y/N]: ");
            out.flush();
            String answer = in.readLine();
            if (answer == null || !answer.trim().equalsIgnoreCase("y")) {
                out.println("Cancelled");
                return EXIT_OK;
            }
        }

        int removed = 0;
        int failed = 0;
        for (RemovalPlan.Outcome outcome : editor.applyRemoval(plan)) {
            if (outcome.result().success()) {
                removed++;
                out.println("  removed: " + outcome.candidate().path());
            } else {
                failed++;
                out.println("  failed:  " + outcome.candidate().path() + " - " + outcome.result().message());
            }
        }
        out.println();
        out.println("Successfully removed: " + removed);
        if (failed > 0) {
            out.println("Errors: " + failed);
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private int login(CredentialStore store, Config config) throws AclInspectorException, IOException {
        AuthorizationSession session = new AuthorizationSession();
        try (LoopbackCallbackServer server = LoopbackCallbackServer.start(URI.create(config.getRedirectUri()), session)) {
            out.println("Open this URL in a browser to authorize:");
            out.println(store.oauthClient().authorizationUrl(session.state()));
            out.printf(Locale.ROOT, "Waiting for the redirect on port %d...%n", server.port());
            String code = session.await(LOGIN_TIMEOUT);
            TokenResponse response = store.oauthClient().exchangeCode(code);
            Token token = store.storeAuthorized(response);
            out.printf(Locale.ROOT, "Saved token to %s (capability: %s, expires %s)%n",
                store.ownedStore().path(), token.getCapability().label(), token.expiryInfo());
            return EXIT_OK;
        }
    }

    static String validate(CommandLine cmd) {
        int actions = 0;
        for (String action : List.of(ONLY_USER, SHARED, REMOVE_USER, INVITE, STRIP_EXPLICIT, LOGIN)) {
            if (cmd.hasOption(action)) {
                actions++;
            }
        }
        if (actions > 1) {
            return "--only-user, --shared, --remove-user, --invite, --strip-explicit and --login are mutually exclusive";
        }
        boolean depthGiven = cmd.hasOption(RECURSIVE) || cmd.hasOption(MAX_DEPTH);
        if (cmd.hasOption(INVITE) && depthGiven) {
            return "--invite cannot be used with -r or --max-depth (invitations are always inherited)";
        }
        if (cmd.hasOption(STRIP_EXPLICIT) && depthGiven) {
            return "--strip-explicit cannot be used with -r or --max-depth";
        }
        if (cmd.hasOption(DRY_RUN) && !cmd.hasOption(REMOVE_USER)) {
            return "--dry-run can only be used with --remove-user";
        }
        if (cmd.hasOption(YES) && !cmd.hasOption(REMOVE_USER)) {
            return "--yes can only be used with --remove-user";
        }
        if (cmd.hasOption(READ_ONLY) && !cmd.hasOption(INVITE)) {
            return "--read-only can only be used with --invite";
        }
        if (cmd.hasOption(EXACT_USER) && !cmd.hasOption(ONLY_USER)) {
            return "--exact-user can only be used with --only-user";
        }
        if (cmd.getArgs().length > 1) {
            return "only one PATH may be given";
        }
        return null;
    }

    static int maxDepth(CommandLine cmd) {
        if (cmd.hasOption(MAX_DEPTH)) {
            String value = cmd.getOptionValue(MAX_DEPTH);
            int depth;
            try {
                depth = Integer.parseInt(value.trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("--max-depth must be a number: " + value, ex);
            }
            if (depth < 0) {
                throw new IllegalArgumentException("--max-depth must be >= 0");
            }
            return depth;
        }
        return cmd.hasOption(RECURSIVE) ? ScanOptions.DEFAULT_RECURSIVE_DEPTH : 0;
    }

    private static boolean requiresWrite(CommandLine cmd) {
        return cmd.hasOption(INVITE) || cmd.hasOption(REMOVE_USER) || cmd.hasOption(STRIP_EXPLICIT);
    }

    Config loadConfig(String file) throws IOException {
        Config.Builder builder = Config.builder();
        if (file != null) {
            Properties properties = new Properties();
            try (Reader reader = Files.newBufferedReader(Paths.get(file), StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
            builder.properties(properties);
        }
        String clientId = env.get(ENV_CLIENT_ID);
        if (clientId != null && !clientId.isBlank()) {
            builder.clientId(clientId);
        }
        String clientSecret = env.get(ENV_CLIENT_SECRET);
        if (clientSecret != null && !clientSecret.isBlank()) {
            builder.clientSecret(clientSecret);
        }
        return builder.build();
    }

    private static void printHelp(PrintStream stream) {
        PrintWriter writer = new PrintWriter(stream);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "acl-inspector [PATH] [options]", null,
            OPTIONS, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }

    private static void configureLogging() {
        try (InputStream config = AclInspectorCli.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException ex) {
            System.err.println("[acl-inspector] cannot load logging configuration: " + ex.getMessage());
        }
    }

    private static void enableDebug() {
        ROOT_LOGGER.setLevel(Level.FINE);
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(Level.FINE);
            }
        }
    }
}
