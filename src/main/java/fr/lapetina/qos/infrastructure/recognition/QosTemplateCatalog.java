package fr.lapetina.qos.infrastructure.recognition;

import java.util.List;
import java.util.Locale;

/**
 * Built-in QoS templates per traffic category.
 *
 * <p>Lookup normalises the class name (lower case, spaces to underscores), then tries an
 * exact template key, then keyword containment in declaration order. Unmatched names get the
 * generic default template.
 */
public final class QosTemplateCatalog {

    public static final List<String> TRAFFIC_CLASSES = List.of(
            "voice", "video_conferencing", "video_streaming", "gaming", "web_browsing",
            "email", "file_transfer", "database", "backup", "monitoring", "management", "unknown"
    );

    private final List<QosTemplate> templates;
    private final QosTemplate defaultTemplate;

    public QosTemplateCatalog(List<QosTemplate> templates, QosTemplate defaultTemplate) {
        this.templates = List.copyOf(templates);
        this.defaultTemplate = defaultTemplate;
    }

    public static QosTemplateCatalog builtIn() {
        return new QosTemplateCatalog(List.of(
                new QosTemplate("voice", List.of("sip", "rtp", "voice", "voip"),
                        "Voice_Policy", "Policy optimised for voice", 15, 7, 20, 10, 0.1),
                new QosTemplate("video_conferencing", List.of("video", "conference", "webrtc", "zoom", "teams"),
                        "VideoConf_Policy", "Policy for video conferencing", 25, 6, 150, 50, 0.5),
                new QosTemplate("video_streaming", List.of("streaming", "youtube", "netflix", "rtmp"),
                        "VideoStream_Policy", "Policy for video streaming", 40, 4, 500, 100, 1.0),
                new QosTemplate("gaming", List.of("game", "gaming", "steam"),
                        "Gaming_Policy", "Policy for online gaming", 20, 5, 50, 20, 0.3),
                new QosTemplate("web_browsing", List.of("http", "https", "web", "browser"),
                        "Web_Policy", "Policy for web browsing", 30, 3, 200, 100, 2.0)
        ), new QosTemplate("default", List.of(),
                "Default_Policy", "Default policy", 10, 2, 1000, 500, 5.0));
    }

    public QosTemplate suggest(String trafficClass) {
        if (trafficClass == null || trafficClass.isBlank()) {
            return defaultTemplate;
        }
        String normalized = trafficClass.trim().toLowerCase(Locale.ROOT).replace(' ', '_');

        for (QosTemplate template : templates) {
            if (template.key().equals(normalized)) {
                return template.customize(trafficClass);
            }
        }
        for (QosTemplate template : templates) {
            if (template.keywords().stream().anyMatch(normalized::contains)) {
                return template.customize(trafficClass);
            }
        }
        return defaultTemplate;
    }

    public List<QosTemplate> getTemplates() {
        return templates;
    }

    public QosTemplate getDefaultTemplate() {
        return defaultTemplate;
    }
}
