package com.ai.autoreply.service;

import com.ai.autoreply.dto.FaqMatch;
import com.ai.autoreply.entity.AgentFaq;
import com.ai.autoreply.entity.FaqUsageLog;
import com.ai.autoreply.entity.SystemLog;
import com.ai.autoreply.repository.AgentFaqRepository;
import com.ai.autoreply.repository.FaqUsageLogRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keyword lookup over an agent's FAQ entries, consulted before the model for widget chats.
 */
@Service
public class FaqService {

    private static final Logger log = LoggerFactory.getLogger(FaqService.class);

    private static final int MAX_KEYWORDS = 10;
    private static final int MIN_WORD_LENGTH = 3;

    private static final Set<String> STOP_WORDS = Set.of(
            "o", "a", "os", "as", "um", "uma", "uns", "umas", "de", "da", "do", "das", "dos",
            "em", "na", "no", "nas", "nos", "por", "para", "com", "sem", "sob", "sobre",
            "entre", "ate", "apos", "antes", "durante", "e", "ou", "mas", "porem", "contudo",
            "que", "qual", "quais", "quando", "quanto", "como", "onde", "porque",
            "se", "nao", "sim", "ja", "ainda", "tambem", "so", "apenas", "muito", "pouco",
            "mais", "menos", "bem", "mal", "aqui", "ali", "la", "ai", "esse", "essa", "este",
            "esta", "isso", "isto", "aquele", "aquela", "meu", "minha", "seu", "sua", "nosso",
            "nossa", "dele", "dela", "deles", "delas", "eu", "tu", "ele", "ela", "vos",
            "eles", "elas", "voce", "voces", "me", "te", "lhe", "lhes",
            "ser", "estar", "ter", "haver", "fazer", "ir", "vir", "poder", "dever", "querer",
            "sao", "foi", "eram", "sera", "seria", "tem", "tinha", "tera", "teria",
            "the", "and", "for", "you", "your", "are", "what", "how", "can", "does", "with", "this", "that");

    private final AgentFaqRepository faqRepository;
    private final FaqUsageLogRepository usageLogRepository;
    private final SystemLogService systemLogService;
    private final Clock clock;

    public FaqService(AgentFaqRepository faqRepository,
                      FaqUsageLogRepository usageLogRepository,
                      SystemLogService systemLogService,
                      Clock clock) {
        this.faqRepository = faqRepository;
        this.usageLogRepository = usageLogRepository;
        this.systemLogService = systemLogService;
        this.clock = clock;
    }

    /**
     * Best-scoring active FAQ, where score is two points per matching keyword plus one per word shared
     * with the FAQ question. Scores below {@code max(2, keywords / 2)} do not match.
     */
    public Optional<FaqMatch> lookup(Long agentId, String text) {
        List<AgentFaq> faqs = faqRepository.findByAgentIdAndActiveTrue(agentId);
        if (faqs.isEmpty() || StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        List<String> userKeywords = extractKeywords(text);
        Set<String> userWords = new LinkedHashSet<>(userKeywords);
        int threshold = Math.max(2, userKeywords.size() / 2);

        FaqMatch best = null;
        for (AgentFaq faq : faqs) {
            int keywordMatches = 0;
            for (String keyword : faq.getKeywords()) {
                if (userWords.contains(fold(keyword).trim())) keywordMatches++;
            }
            Set<String> questionWords = new LinkedHashSet<>(extractKeywords(faq.getQuestion()));
            int questionMatches = 0;
            for (String word : userWords) {
                if (questionWords.contains(word)) questionMatches++;
            }
            int score = keywordMatches * 2 + questionMatches;
            if (score >= threshold && (best == null || score > best.getScore())) {
                best = new FaqMatch(faq, score);
            }
        }
        if (best != null) {
            log.debug("FAQ {} matched for agent {} with score {}", best.getFaq().getId(), agentId, best.getScore());
        }
        return Optional.ofNullable(best);
    }

    /**
     * Bumps the usage counter and writes a usage row. Failures are logged only.
     */
    public void recordUsage(FaqMatch match, Long agentId, String sessionId, SystemLog.Source source) {
        try {
            faqRepository.incrementUsage(match.getFaq().getId(), clock.instant());
            usageLogRepository.save(FaqUsageLog.builder()
                    .faqId(match.getFaq().getId())
                    .agentId(agentId)
                    .sessionId(sessionId)
                    .source(source)
                    .build());
        } catch (Exception e) {
            log.warn("Failed to record usage of FAQ {}", match.getFaq().getId(), e);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("faqId", match.getFaq().getId());
        details.put("question", match.getFaq().getQuestion());
        details.put("score", match.getScore());
        details.put("sessionId", sessionId);
        systemLogService.record(agentId, SystemLog.Type.FAQ_MATCH, "FAQ answered: \"" + match.getFaq().getQuestion() + "\"",
                details, null, source);
    }

    static List<String> extractKeywords(String text) {
        List<String> keywords = new ArrayList<>();
        if (StringUtils.isBlank(text)) {
            return keywords;
        }
        String cleaned = fold(text).replaceAll("[^\\p{Alnum}\\s]", " ");
        for (String word : cleaned.split("\\s+")) {
            if (word.length() >= MIN_WORD_LENGTH && !STOP_WORDS.contains(word)) {
                keywords.add(word);
                if (keywords.size() == MAX_KEYWORDS) break;
            }
        }
        return keywords;
    }

    private static String fold(String text) {
        return StringUtils.stripAccents(StringUtils.defaultString(text)).toLowerCase(Locale.ROOT);
    }
}
