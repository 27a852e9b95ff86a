package com.dnobretech.contentalignerbackend;

import com.dnobretech.contentalignerbackend.alignment.AssignmentStrategy;
import com.dnobretech.contentalignerbackend.alignment.GreedyAssignmentMatcher;
import com.dnobretech.contentalignerbackend.service.AlignmentService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.web.filter.CorsFilter;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "aligner.embeddings.base-url=http://127.0.0.1:1",
        "aligner.translate.base-url=http://127.0.0.1:1"
})
class ContentAlignerBackendApplicationTests {

    @Autowired AlignmentService alignmentService;
    @Autowired AssignmentStrategy assignmentStrategy;
    @Autowired CorsFilter corsFilter;

    @Test
    void contextLoads() {
        assertThat(alignmentService).isNotNull();
        assertThat(assignmentStrategy).isInstanceOf(GreedyAssignmentMatcher.class);
        assertThat(corsFilter).isNotNull();
    }
}
