package com.example.docxstyle;

import com.example.docxstyle.config.DocxStyleProperties;
import com.example.docxstyle.service.DocxStyleService;
import com.example.docxstyle.util.docx.DocxFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class DocxStyleApplicationTest {

    @Autowired
    private ApplicationContext applicationContext;

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("应用上下文加载，配置从 application.yml 绑定")
    void contextLoads() {
        assertThat(applicationContext.getBean(DocxStyleService.class)).isNotNull();
        DocxStyleProperties properties = applicationContext.getBean(DocxStyleProperties.class);
        assertThat(properties.getToc().getExitMinEntries()).isEqualTo(5);
        assertThat(properties.getRender().getTocLineWidth()).isEqualTo(60);
        assertThat(properties.getCors().getAllowedOrigins()).containsExactly("*");
    }

    @Test
    @DisplayName("跨域预检请求放行")
    void allowsCorsPreflight() throws Exception {
        mockMvc.perform(options("/api/docx-style/convert")
                        .header("Origin", "http://localhost:3000")
                        .header("Access-Control-Request-Method", "POST"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "*"));
    }

    @Test
    @DisplayName("上传真实DOCX完成端到端转换")
    void convertsUploadedDocx() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "hello.docx", null, DocxFixtures.docx("Hello"));

        mockMvc.perform(multipart("/api/docx-style/convert").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.paragraph_count").value(1))
                .andExpect(jsonPath("$.data.tree.nodes[0].text").value("Hello"));
    }
}
