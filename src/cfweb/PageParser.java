package cfweb;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cf.CFException;
import cf.CFHttpStatusException;
import cf.CFParseException;
import cf.RawResponse;

/**
 * Reads problem pages and contest problem tables.
 *
 * Every field of a problem is looked up on its own; a region the page lacks
 * leaves that field empty rather than failing the whole parse. Use
 * {@link #verifyPageStructure()} to find out whether the selectors still fit the site.
 */
public class PageParser {

    private static final Logger log = LoggerFactory.getLogger(PageParser.class);

    private static final Pattern RATING_TAG = Pattern.compile("^\\*(\\d+)$");
    private static final Pattern PROBLEM_HREF = Pattern.compile("/problem/([A-Z]\\d*)$");

    static final String PROBE_PATH = "/problemset/problem/1/A";

    private final AuthSession session;
    private final Selectors selectors;

    public PageParser(AuthSession session) {
        this(session, new DefaultSelectors());
    }

    public PageParser(AuthSession session, Selectors selectors) {
        this.session = session;
        this.selectors = selectors;
    }

    public Selectors getSelectors() {
        return selectors;
    }

    private Document fetch(String url, String what) throws CFException, InterruptedException {
        RawResponse resp = session.get(url);
        if (!resp.isSuccess()) {
            throw new CFHttpStatusException(what, resp.statusCode, resp.bodyAsString());
        }
        if (resp.truncated) {
            log.debug("{} exceeds {} bytes, parsing the truncated page", url, session.getConfig().getMaxPageBytes());
        }
        return Jsoup.parse(resp.bodyAsString(), url);
    }

    /*
     * Problems
     */

    public ParsedProblem parseProblem(int contestId, String index) throws CFException, InterruptedException {
        String url = String.format("%s/contest/%d/problem/%s", session.getBaseUrl(), contestId, index);
        return parseProblemPage(fetch(url, "problem page"), contestId, index, url);
    }

    public ParsedProblem parseProblemset(int contestId, String index) throws CFException, InterruptedException {
        String url = String.format("%s/problemset/problem/%d/%s", session.getBaseUrl(), contestId, index);
        return parseProblemPage(fetch(url, "problemset page"), contestId, index, url);
    }

    public ParsedProblem parseGymProblem(int gymId, String index) throws CFException, InterruptedException {
        String url = String.format("%s/gym/%d/problem/%s", session.getBaseUrl(), gymId, index);
        return parseProblemPage(fetch(url, "gym problem page"), gymId, index, url);
    }

    /**
     * Parses an already downloaded problem page.
     */
    public ParsedProblem parseProblemHtml(String html, int contestId, String index, String url) {
        return parseProblemPage(Jsoup.parse(html, url), contestId, index, url);
    }

    private ParsedProblem parseProblemPage(Document doc, int contestId, String index, String url) {
        Element title = doc.selectFirst(selectors.title());
        String name = title == null ? "" : HtmlText.cleanTitle(title.text());

        Set<String> tags = new LinkedHashSet<>();
        Integer rating = null;
        for (Element tag : doc.select(selectors.tags())) {
            String text = HtmlText.collapseWhitespace(tag.text());
            Matcher m = RATING_TAG.matcher(text);
            if (m.matches()) {
                try {
                    rating = Integer.parseInt(m.group(1));
                } catch (NumberFormatException e) {
                    log.debug("ignoring rating tag '{}'", text);
                }
            } else if (!text.isEmpty()) {
                tags.add(text);
            }
        }

        ParsedProblem problem = new ParsedProblem(contestId, index, name,
                limitText(doc.selectFirst(selectors.timeLimit())),
                limitText(doc.selectFirst(selectors.memoryLimit())),
                statementText(doc.selectFirst(selectors.statement())),
                sectionText(doc.selectFirst(selectors.inputSpec())),
                sectionText(doc.selectFirst(selectors.outputSpec())),
                sectionText(doc.selectFirst(selectors.note())),
                parseSamples(doc), tags, rating, url);
        log.debug("parsed {} with {} samples", problem.getProblemId(), problem.samples.size());
        return problem;
    }

    // "time limit per test1 second" -> "1 second"
    private String limitText(Element limit) {
        if (limit == null) {
            return "";
        }
        String own = HtmlText.collapseWhitespace(limit.ownText());
        return own.isEmpty() ? sectionText(limit) : own;
    }

    private String sectionText(Element section) {
        if (section == null) {
            return "";
        }
        Element copy = section.clone();
        copy.select(selectors.sectionTitle()).remove();
        return HtmlText.collapseWhitespace(copy.text());
    }

    /**
     * Legend text: the container's own text plus its paragraphs. Nested divs (images, tables of
     * figures) are skipped.
     */
    static String statementText(Element legend) {
        if (legend == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Node child : legend.childNodes()) {
            if (child instanceof TextNode) {
                sb.append(((TextNode) child).text()).append(' ');
            } else if (child instanceof Element && ((Element) child).tagName().equals("p")) {
                sb.append(((Element) child).text()).append(' ');
            }
        }
        return HtmlText.collapseWhitespace(sb.toString());
    }

    /**
     * Takes every block that pairs exactly one input with one output and skips the others. Pages
     * without any such block list inputs and outputs side by side, which are zipped up to the
     * shorter list.
     */
    List<Sample> parseSamples(Document doc) {
        List<Sample> samples = new ArrayList<>();
        Element container = doc.selectFirst(selectors.sampleContainer());
        if (container == null) {
            return samples;
        }

        for (Element block : container.select(selectors.sampleBlock())) {
            Elements in = block.select(selectors.sampleInput());
            Elements out = block.select(selectors.sampleOutput());
            if (in.size() != 1 || out.size() != 1) {
                log.debug("skipping sample block with {} inputs and {} outputs", in.size(), out.size());
                continue;
            }
            samples.add(new Sample(samples.size() + 1, HtmlText.preText(in.first()), HtmlText.preText(out.first())));
        }
        if (!samples.isEmpty()) {
            return samples;
        }

        Elements inputs = container.select(selectors.sampleInput());
        Elements outputs = container.select(selectors.sampleOutput());
        if (inputs.size() != outputs.size()) {
            log.debug("sample inputs and outputs differ in count: {} vs {}", inputs.size(), outputs.size());
        }
        for (int i = 0; i < Math.min(inputs.size(), outputs.size()); i++) {
            samples.add(new Sample(i + 1, HtmlText.preText(inputs.get(i)), HtmlText.preText(outputs.get(i))));
        }
        return samples;
    }

    /*
     * Contests
     */

    /**
     * Problems listed in a contest's problem table. Only index, name and url are filled in.
     */
    public List<ParsedProblem> parseContestProblems(int contestId) throws CFException, InterruptedException {
        String base = contestId >= SubmissionEngine.GYM_ID_THRESHOLD ? "gym" : "contest";
        String url = String.format("%s/%s/%d", session.getBaseUrl(), base, contestId);
        Document doc = fetch(url, "contest page");

        List<ParsedProblem> problems = new ArrayList<>();
        for (Element row : doc.select(selectors.contestProblemRow())) {
            Element link = row.selectFirst(selectors.contestProblemLink());
            if (link == null) {
                continue;
            }
            String href = link.attr("href");
            Matcher m = PROBLEM_HREF.matcher(href);
            String index = m.find() ? m.group(1) : HtmlText.collapseWhitespace(link.text());

            Elements cells = row.select("td");
            String name = "";
            if (cells.size() > 1) {
                Element nameLink = cells.get(1).selectFirst("a");
                name = HtmlText.collapseWhitespace(nameLink != null ? nameLink.text() : cells.get(1).text());
            }
            String problemUrl = link.absUrl("href");
            problems.add(ParsedProblem.stub(contestId, index, name,
                    problemUrl.isEmpty() ? session.getBaseUrl() + href : problemUrl));
        }
        return problems;
    }

    /*
     * Health
     */

    /**
     * Fetches a well-known problem page and checks every required region is present.
     *
     * @throws CFParseException naming the missing regions and the selector version
     */
    public void verifyPageStructure() throws CFException, InterruptedException {
        Document doc = fetch(session.getBaseUrl() + PROBE_PATH, "structure probe");
        List<String> missing = new ArrayList<>();
        for (Map.Entry<String, String> group : selectors.requiredProblemGroups().entrySet()) {
            if (doc.select(group.getValue()).isEmpty()) {
                missing.add(group.getKey());
            }
        }
        if (!missing.isEmpty()) {
            throw new CFParseException(String.format("page structure changed (selectors %s): missing %s",
                    selectors.version(), String.join(", ", missing)));
        }
        log.debug("page structure matches selectors {}", selectors.version());
    }
}
