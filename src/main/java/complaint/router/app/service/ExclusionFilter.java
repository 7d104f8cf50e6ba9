package complaint.router.app.service;

import complaint.router.app.config.ComplaintRouterProperties;
import complaint.router.app.model.InboundMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Sender and subject patterns that disqualify a message before any scoring.
 * Patterns match from the start of the value, case-insensitively. Entries that are not valid
 * regular expressions (such as {@code *@*.gov}) are read as globs.
 */
@Slf4j
@Component
public class ExclusionFilter {
    private final List<Pattern> senderPatterns;
    private final List<Pattern> subjectPatterns;

    @Autowired
    public ExclusionFilter(ComplaintRouterProperties properties) {
        this(properties.getExclusions().getFrom(), properties.getExclusions().getSubject());
    }

    public ExclusionFilter(List<String> senderPatterns, List<String> subjectPatterns) {
        this.senderPatterns = compileAll(senderPatterns);
        this.subjectPatterns = compileAll(subjectPatterns);
    }

    /**
     * @return a description of the first matching exclusion, empty if the message may be scored
     */
    public Optional<String> match(InboundMessage message) {
        String sender = message.getSender() == null ? "" : message.getSender();
        for (Pattern pattern : senderPatterns) {
            if (pattern.matcher(sender).lookingAt()) {
                return Optional.of("sender '" + sender + "' matches " + pattern.pattern());
            }
        }
        String subject = message.getSubject() == null ? "" : message.getSubject();
        for (Pattern pattern : subjectPatterns) {
            if (pattern.matcher(subject).lookingAt()) {
                return Optional.of("subject '" + subject + "' matches " + pattern.pattern());
            }
        }
        return Optional.empty();
    }

    static Pattern compile(String expression) {
        try {
            return Pattern.compile(expression, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            log.debug("Exclusion '{}' is not a regular expression, reading it as a glob", expression);
            return Pattern.compile(globToRegex(expression), Pattern.CASE_INSENSITIVE);
        }
    }

    static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*':
                    regex.append(".*");
                    break;
                case '?':
                    regex.append('.');
                    break;
                default:
                    regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        // a glob describes the whole value
        return regex.append('$').toString();
    }

    private static List<Pattern> compileAll(List<String> expressions) {
        List<Pattern> compiled = new ArrayList<>();
        if (expressions == null) {
            return compiled;
        }
        for (String expression : expressions) {
            if (expression != null && !expression.isBlank()) {
                compiled.add(compile(expression.trim()));
            }
        }
        return compiled;
    }
}
