package com.spring.listentogether.dto.help;

import java.util.List;

/**
 * 명령어 도움말
 */
public record HelpResponse(
    String title,
    List<Section> sections,
    String tip
) {
    public record Section(String name, List<Command> commands) {}

    public record Command(String method, String path, String description) {}
}
