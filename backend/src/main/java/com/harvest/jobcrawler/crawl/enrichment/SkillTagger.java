package com.harvest.jobcrawler.crawl.enrichment;

import com.harvest.jobcrawler.crawl.model.SkillTag;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Dictionary-based skill tagging over posting descriptions.
 */
@Component
public class SkillTagger {
    static final double DICTIONARY_CONFIDENCE = 1.0;

    private static final Map<String, List<String>> SKILLS = new LinkedHashMap<>();

    static {
        SKILLS.put("Programming", List.of(
            "Python", "Java", "Javascript", "Node.js", "Ruby", "Golang", "Go", "C++", "C#", "PHP",
            "Rust", "Swift", "Kotlin", "Typescript", "Dart", "SQL", "HTML", "CSS"
        ));
        SKILLS.put("Framework", List.of(
            "Django", "Flask", "Spring", "React", "Vue", "Angular", "Express", "Laravel", "Rails",
            "FastAPI", "Next.js", "Nuxt.js", "Flutter", "Tailwind"
        ));
        SKILLS.put("Tool/Infra", List.of(
            "Docker", "Kubernetes", "K8s", "AWS", "GCP", "Azure", "Git", "Jenkins", "CI/CD",
            "Redis", "Elasticsearch", "PostgreSQL", "MySQL", "MongoDB", "RabbitMQ", "Kafka"
        ));
        SKILLS.put("AI/Data", List.of(
            "PyTorch", "TensorFlow", "Scikit-Learn", "Numpy", "Pandas", "LLM", "OpenAI",
            "NLP", "Computer Vision"
        ));
        SKILLS.put("SoftSkill", List.of(
            "Communication", "專案管理", "溝通", "Excel", "PPT", "Word"
        ));
    }

    private final List<Entry> entries = new ArrayList<>();

    public SkillTagger() {
        for (Map.Entry<String, List<String>> group : SKILLS.entrySet()) {
            for (String skill : group.getValue()) {
                // ASCII word boundaries so "C++" and "CI/CD" still match and CJK terms match inline.
                Pattern pattern = Pattern.compile(
                    "(?<![A-Za-z0-9_])" + Pattern.quote(skill) + "(?![A-Za-z0-9_])",
                    Pattern.CASE_INSENSITIVE
                );
                entries.add(new Entry(skill, group.getKey(), pattern));
            }
        }
    }

    public List<SkillTag> tag(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        List<SkillTag> tags = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.pattern().matcher(text).find() && seen.add(entry.name().toLowerCase(Locale.ROOT))) {
                tags.add(new SkillTag(entry.name(), entry.type(), DICTIONARY_CONFIDENCE));
            }
        }
        return tags;
    }

    private record Entry(String name, String type, Pattern pattern) {
    }
}
