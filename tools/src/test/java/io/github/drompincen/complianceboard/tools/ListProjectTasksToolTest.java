package io.github.drompincen.complianceboard.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.complianceboard.protocol.api.PageResult;
import io.github.drompincen.complianceboard.protocol.api.ProjectTaskDto;
import io.github.drompincen.complianceboard.protocol.api.TaskQuery;
import io.github.drompincen.complianceboard.protocol.api.ToolRiskProfile;
import io.github.drompincen.complianceboard.runtime.task.ProjectTaskService;
import io.github.drompincen.complianceboard.runtime.tools.ToolContext;
import io.github.drompincen.complianceboard.runtime.tools.ToolResult;
import io.github.drompincen.complianceboard.runtime.tools.ToolStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ListProjectTasksToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock private ProjectTaskService taskService;
    @Mock private ToolStream stream;

    private ListProjectTasksTool tool;

    @BeforeEach
    void setUp() {
        tool = new ListProjectTasksTool();
        tool.setProjectTaskService(taskService);
        when(taskService.list(any(), any())).thenReturn(PageResult.of(List.of(), 0, 5, 0));
    }

    @Test
    void isReadOnly() {
        assertThat(tool.riskProfiles()).containsExactly(ToolRiskProfile.READ_ONLY);
        assertThat(tool.mutatesProject()).isFalse();
    }

    @Test
    void emptyQueryStillCountsAsASearch() {
        ToolResult result = tool.execute(ToolContext.forProject("p"), MAPPER.createObjectNode().put("q", ""), stream);

        assertThat(result.success()).isTrue();
        assertThat(result.output().get("total").asLong()).isZero();
        verify(taskService).list(eq("p"), eq(new TaskQuery(null, null, null, "")));
    }

    @Test
    void passesPagingAndStatus() {
        tool.execute(ToolContext.forProject("p"), MAPPER.createObjectNode()
                .put("status", "in-progress").put("limit", 20).put("offset", 40), stream);

        verify(taskService).list(eq("p"), eq(new TaskQuery(20, 40, ProjectTaskDto.TaskStatus.IN_PROGRESS, null)));
    }
}
