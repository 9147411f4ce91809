package im.arun.lcms.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LcmsConfig {
    @JsonProperty("root_name")
    private String rootName = "Library";

    @JsonProperty("confirm_removals")
    private boolean confirmRemovals = true;

    @JsonProperty("history_file")
    private String historyFile = System.getProperty("user.home") + "/.lcms_history";

    @JsonProperty("prompt")
    private String prompt = "lcms> ";

    @JsonProperty("keyword_case_sensitive")
    private boolean keywordCaseSensitive = false;
}
