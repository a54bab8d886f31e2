package com.archebuild.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ListCommandTest {

    @Test
    void list_withoutFilters_listsBundledRecords() {
        CliTestSupport.Result result = CliTestSupport.run("-q", "list");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out())
            .contains("database version 0.7")
            .contains("OuterWall_iwu_heavy_0_1976")
            .contains("Window_waermeschutz_dreifach_0_2100");
    }

    @Test
    void list_withFilters_listsOnlyMatchingRecords() {
        CliTestSupport.Result result = CliTestSupport.run("-q", "list",
            "--category", "OuterWall", "--construction", "iwu_heavy", "--year", "1965");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out())
            .contains("OuterWall_iwu_heavy_0_1976")
            .doesNotContain("OuterWall_iwu_heavy_1977_2100")
            .doesNotContain("Window_")
            .contains("1 of 51 record(s)");
    }

    @Test
    void list_withUnknownCategory_returnsError() {
        CliTestSupport.Result result = CliTestSupport.run("-q", "list", "--category", "Chimney");

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("Unknown element category: Chimney");
    }

    @Test
    void list_withOnlyTypeElementsFile_returnsError() {
        CliTestSupport.Result result = CliTestSupport.run("-q", "list", "--type-elements", "TypeElements.json");

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("must be given together");
    }
}
