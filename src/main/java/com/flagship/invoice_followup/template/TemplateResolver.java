package com.flagship.invoice_followup.template;

import com.flagship.invoice_followup.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Chooses the template that applies to a company and renders it.
 *
 * Selection: for each (channel, day offset) the company's own template wins over the
 * global default. Rendering replaces {{name}} placeholders; unknown or missing values
 * render as the empty string, so rendering a well-formed template never fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TemplateResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_]+)\\s*}}");

    private final MessageTemplateRepository templateRepository;

    /**
     * All effective templates for a company, ordered by day offset then channel.
     */
    @Transactional(readOnly = true)
    public List<MessageTemplate> templatesFor(UUID companyId) {
        return select(companyId, templateRepository.findApplicableTo(companyId).stream()
            .map(MessageTemplateEntity::toDomain)
            .toList());
    }

    @Transactional(readOnly = true)
    public Optional<MessageTemplate> resolve(UUID companyId, Channel channel, int dayOffset) {
        return templatesFor(companyId).stream()
            .filter(t -> t.getChannel() == channel && t.getDayOffset() == dayOffset)
            .findFirst();
    }

    @Transactional(readOnly = true)
    public MessageTemplate getTemplate(UUID templateId) {
        return templateRepository.findById(templateId)
            .map(MessageTemplateEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("MessageTemplate", templateId));
    }

    public RenderedMessage render(MessageTemplate template, RenderContext context) {
        Map<String, String> variables = context.variables();
        String subject = template.getSubject() == null ? null : substitute(template.getSubject(), variables);
        return new RenderedMessage(subject, substitute(template.getBody(), variables));
    }

    /**
     * Applies the company-beats-global rule to a mixed list of templates.
     */
    static List<MessageTemplate> select(UUID companyId, List<MessageTemplate> candidates) {
        Map<String, MessageTemplate> chosen = new LinkedHashMap<>();
        for (MessageTemplate template : candidates) {
            if (!template.isGlobal() && !template.getCompanyId().equals(companyId)) {
                continue;
            }
            String key = template.getChannel() + ":" + template.getDayOffset();
            MessageTemplate current = chosen.get(key);
            if (current == null || (current.isGlobal() && !template.isGlobal())) {
                chosen.put(key, template);
            }
        }
        return chosen.values().stream()
            .sorted(Comparator.comparingInt(MessageTemplate::getDayOffset)
                .thenComparing(MessageTemplate::getChannel))
            .toList();
    }

    private static String substitute(String text, Map<String, String> variables) {
        if (text == null) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = variables.getOrDefault(matcher.group(1), "");
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
