package com.example.faculty_collab_ingest.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 教师名单 JSON 中的一项，字段名与文件保持一致
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FacultyRosterEntry {

    @JsonProperty("faculty_name")
    private String facultyName;

    @JsonProperty("dblp_pid")
    private String dblpPid;

    @JsonProperty("dblp_matched")
    private boolean dblpMatched;

    @JsonProperty("all_matches")
    private List<Match> allMatches = new ArrayList<>();

    private String email;
    private String phone;
    private String designation;
    private String department;

    @JsonProperty("h_index")
    private Integer hindex;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Match {
        @JsonProperty("dblp_pid")
        private String dblpPid;

        @JsonProperty("dblp_name")
        private String dblpName;
    }
}
