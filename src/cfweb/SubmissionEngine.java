package cfweb;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cf.CFAuthException;
import cf.CFException;
import cf.CFHttpStatusException;
import cf.CFParseException;
import cf.CFSubmitException;
import cf.CFTimeoutException;
import cf.RawResponse;

/**
 * Submits solutions through the HTML form and follows them until judged.
 *
 * <p>The site does not return the id of a new submission, so after a
 * successful post the newest row of the caller's own listing is taken to be
 * it. Two submissions racing from the same account can therefore be mixed up.
 */
public class SubmissionEngine {

    private static final Logger log = LoggerFactory.getLogger(SubmissionEngine.class);

    /** Contest ids from here on are gyms, served under {@code /gym/}. */
    public static final int GYM_ID_THRESHOLD = 100000;

    private static final Pattern ON_TEST = Pattern.compile("on test (\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PROBLEM_HREF = Pattern.compile("/problem/([A-Z]\\d*)");
    private static final DateTimeFormatter CREATED_FORMAT = DateTimeFormatter.ofPattern("MMM/dd/yyyy HH:mm",
            Locale.US);
    private static final ZoneId SITE_ZONE = ZoneId.of("Europe/Moscow");

    private final AuthSession session;
    private final Selectors selectors;

    public SubmissionEngine(AuthSession session) throws CFAuthException {
        this(session, new DefaultSelectors());
    }

    public SubmissionEngine(AuthSession session, Selectors selectors) throws CFAuthException {
        if (session.getHandle().isEmpty()) {
            throw new CFAuthException("handle not set");
        }
        if (!session.isAuthenticated()) {
            throw new CFAuthException("session is not authenticated: no session cookie");
        }
        this.session = session;
        this.selectors = selectors;
    }

    private static String namespace(int contestId) {
        return contestId >= GYM_ID_THRESHOLD ? "gym" : "contest";
    }

    private String contestUrl(String namespace, int contestId, String path) {
        return String.format("%s/%s/%d/%s", session.getBaseUrl(), namespace, contestId, path);
    }

    private Document fetch(String url, String what) throws CFException, InterruptedException {
        RawResponse resp = session.get(url);
        if (!resp.isSuccess()) {
            throw new CFHttpStatusException(what, resp.statusCode, resp.bodyAsString());
        }
        return Jsoup.parse(resp.bodyAsString(), url);
    }

    /*
     * Submitting
     */

    /**
     * Submits {@code source} to a regular contest problem and returns the newest entry of the listing.
     *
     * @throws CFSubmitException if the site rejected the source
     */
    public SubmissionResult submit(int contestId, String index, String languageId, String source)
            throws CFException, InterruptedException {
        return submit("contest", contestId, index, languageId, source);
    }

    public SubmissionResult submitToGym(int gymId, String index, String languageId, String source)
            throws CFException, InterruptedException {
        return submit("gym", gymId, index, languageId, source);
    }

    private SubmissionResult submit(String namespace, int contestId, String index, String languageId, String source)
            throws CFException, InterruptedException {
        if (source == null || index == null || languageId == null) {
            throw new IllegalArgumentException("problem index, language and source are required");
        }
        String submitUrl = contestUrl(namespace, contestId, "submit");
        Document form = fetch(submitUrl, "submit page");

        Optional<String> csrf = CsrfExtractor.extract(form);
        if (csrf.isEmpty()) {
            throw new CFAuthException("csrf token not found on submit page");
        }

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("csrf_token", csrf.get());
        fields.put("ftaa", CsrfExtractor.hiddenInput(form, "ftaa").orElse(""));
        fields.put("bfaa", CsrfExtractor.hiddenInput(form, "bfaa").orElse(""));
        fields.put("action", "submitSolutionFormSubmitted");
        fields.put("submittedProblemIndex", index);
        fields.put("programTypeId", languageId);
        fields.put("source", source);
        fields.put("tabSize", "4");
        fields.put("sourceFile", "");

        log.debug("submitting {}{} ({} bytes, language {})", contestId, index, source.length(), languageId);
        RawResponse resp = session.postForm(
                submitUrl + "?csrf_token=" + URLEncoder.encode(csrf.get(), StandardCharsets.UTF_8), fields, false);
        SubmitOutcome outcome = SubmitOutcome.classify(resp.statusCode, resp.header("Location"), resp.bodyAsString());
        log.debug("submit outcome {}", outcome);

        Document listing = fetch(contestUrl(namespace, contestId, "my"), "submission listing");
        Element newest = listing.selectFirst(selectors.submissionRow());
        if (newest == null) {
            throw new CFParseException("submission accepted but no submissions found on the listing");
        }
        SubmissionResult result = parseSubmissionRow(newest, contestId);
        if (result.problemIndex.isEmpty()) {
            result = new SubmissionResult(result.submissionId, contestId, index, result.state, result.time,
                    result.memoryBytes, result.passedTests, result.submittedAt);
        }
        log.debug("submitted as #{}", result.submissionId);
        return result;
    }

    /*
     * Reading back
     */

    SubmissionResult parseSubmissionRow(Element row, int contestId) throws CFParseException {
        long id;
        try {
            id = Long.parseLong(row.attr("data-submission-id").trim());
        } catch (NumberFormatException e) {
            throw new CFParseException("bad submission id '" + row.attr("data-submission-id") + "'", e);
        }

        JudgeState state = JudgeState.fromStatusText(cellText(row, selectors.submissionStatus()));

        String problemIndex = "";
        Element problem = row.selectFirst(selectors.submissionProblem());
        if (problem != null) {
            Matcher m = PROBLEM_HREF.matcher(problem.attr("href"));
            if (m.find()) {
                problemIndex = m.group(1);
            }
        }

        Instant created = null;
        Element when = row.selectFirst(selectors.submissionCreated());
        if (when != null) {
            try {
                created = LocalDateTime.parse(HtmlText.collapseWhitespace(when.text()), CREATED_FORMAT)
                        .atZone(SITE_ZONE).toInstant();
            } catch (DateTimeParseException e) {
                log.debug("unreadable submission time '{}'", when.text());
            }
        }

        return new SubmissionResult(id, contestId, problemIndex, state,
                Units.parseTime(cellText(row, selectors.submissionTime())),
                Units.parseMemory(cellText(row, selectors.submissionMemory())),
                passedTests(state), created);
    }

    private static String cellText(Element row, String selector) {
        Element cell = row.selectFirst(selector);
        return cell == null ? "" : HtmlText.collapseWhitespace(cell.text());
    }

    // "Wrong answer on test 5" means four tests passed
    private static int passedTests(JudgeState state) {
        if (!state.isTerminal()) {
            return 0;
        }
        Matcher m = ON_TEST.matcher(state.status);
        if (!m.find()) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(m.group(1)) - 1);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private Optional<SubmissionResult> findInListing(long submissionId, int contestId)
            throws CFException, InterruptedException {
        Document listing = fetch(contestUrl(namespace(contestId), contestId, "my"), "submission listing");
        Element row = listing.selectFirst(String.format("tr[data-submission-id=%d]", submissionId));
        return row == null ? Optional.empty() : Optional.of(parseSubmissionRow(row, contestId));
    }

    /**
     * Polls the caller's listing until the submission has a final verdict. The first poll happens
     * immediately, later ones every {@link cf.CFConfig#getPollInterval() poll interval}.
     *
     * @throws CFTimeoutException if no final verdict appeared within {@code timeout}
     */
    public SubmissionResult waitForVerdict(long submissionId, int contestId, Duration timeout)
            throws CFException, InterruptedException {
        long interval = session.getConfig().getPollInterval().toNanos();
        long deadline = System.nanoTime() + timeout.toNanos();
        int polls = 0;
        while (true) {
            Optional<SubmissionResult> result = findInListing(submissionId, contestId);
            polls++;
            if (result.isPresent()) {
                log.debug("poll {} of #{}: {}", polls, submissionId, result.get().state);
                if (result.get().isTerminal()) {
                    return result.get();
                }
            } else {
                log.debug("poll {}: #{} not on the listing yet", polls, submissionId);
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new CFTimeoutException(submissionId, timeout);
            }
            TimeUnit.NANOSECONDS.sleep(Math.min(interval, remaining));
        }
    }

    /**
     * Reads a submission's own page.
     */
    public SubmissionResult getSubmission(long submissionId, int contestId) throws CFException, InterruptedException {
        Document doc = fetch(contestUrl(namespace(contestId), contestId, "submission/" + submissionId),
                "submission page");

        Element banner = doc.selectFirst(selectors.verdictBanner());
        if (banner == null) {
            throw new CFParseException("no verdict on the page of submission " + submissionId);
        }
        String text = HtmlText.collapseWhitespace(banner.text());
        JudgeState state;
        if (banner.hasClass("verdict-accepted")) {
            state = JudgeState.terminal(text.isEmpty() ? "Accepted" : text);
        } else if (banner.hasClass("verdict-waiting")) {
            state = JudgeState.fromStatusText(text);
            if (state.isTerminal()) {
                state = JudgeState.running();
            }
        } else {
            state = JudgeState.terminal(text);
        }

        Duration time = Duration.ZERO;
        long memory = 0;
        Element table = doc.selectFirst(selectors.resultsTable());
        if (table != null) {
            for (Element cell : table.select("td")) {
                String cellText = cell.text();
                if (time.isZero()) {
                    time = Units.parseTime(cellText);
                }
                if (memory == 0) {
                    memory = Units.parseMemory(cellText);
                }
            }
        }

        String problemIndex = "";
        Element problem = doc.selectFirst(selectors.submissionProblem());
        if (problem != null) {
            Matcher m = PROBLEM_HREF.matcher(problem.attr("href"));
            if (m.find()) {
                problemIndex = m.group(1);
            }
        }
        return new SubmissionResult(submissionId, contestId, problemIndex, state, time, memory, passedTests(state),
                null);
    }

    /*
     * Health
     */

    /**
     * Checks that the submit form of {@code contestId} still has every field a submission needs.
     *
     * @throws CFParseException listing the missing fields
     */
    public void verifySubmitPage(int contestId) throws CFException, InterruptedException {
        Document form = fetch(contestUrl(namespace(contestId), contestId, "submit"), "submit page");
        List<String> missing = new ArrayList<>();
        if (CsrfExtractor.extract(form).isEmpty()) {
            missing.add("csrf_token");
        }
        if (form.select(selectors.submitProblemIndex()).isEmpty()) {
            missing.add("submittedProblemIndex");
        }
        if (form.select(selectors.submitLanguage()).isEmpty()) {
            missing.add("programTypeId");
        }
        if (form.select(selectors.submitSource()).isEmpty()) {
            missing.add("source");
        }
        if (!missing.isEmpty()) {
            throw new CFParseException(String.format("submit page is missing elements: %s (selectors %s)",
                    String.join(", ", missing), selectors.version()));
        }
    }
}
