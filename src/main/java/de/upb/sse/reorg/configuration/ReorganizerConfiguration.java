package de.upb.sse.reorg.configuration;

import lombok.*;

import java.util.List;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class ReorganizerConfiguration {
    /** Attribute the translator puts on the modules it generates per header. */
    private String headerAttribute = "header_src";
    /** Header paths containing this marker are system headers. */
    private String stdIncludeMarker = "/usr/include";
    /** Module collecting everything that came from system headers. */
    private String stdlibModuleName = "stdlib";
    /** Path segments stripped before import paths are compared. */
    private List<String> relativeSegments = List.of("self", "super");
    private boolean dumpStages = false;
}
