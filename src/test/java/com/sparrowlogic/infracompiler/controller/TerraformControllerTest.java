package com.sparrowlogic.infracompiler.controller;

import com.sparrowlogic.infracompiler.compiler.ResourceCompilerService;
import com.sparrowlogic.infracompiler.ir.Program;
import com.sparrowlogic.infracompiler.model.AwsProvider;
import com.sparrowlogic.infracompiler.model.Region;
import com.sparrowlogic.infracompiler.model.Resource;
import com.sparrowlogic.infracompiler.service.AwsInfrastructureService;
import com.sparrowlogic.infracompiler.service.HclRenderService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TerraformController.class)
class TerraformControllerTest {

    private static final String HCL = "provider \"aws\" {\n  region = \"us-east-1\"\n}\n";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AwsInfrastructureService awsService;

    @MockBean
    private ResourceCompilerService compilerService;

    @MockBean
    private HclRenderService renderService;

    @Test
    void shouldShowForm() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(view().name("form"));
    }

    @Test
    void shouldGenerateTerraformForVpc() throws Exception {
        List<Resource> resources = List.of();
        var program = new Program(List.of());
        when(awsService.importNetwork("prod", Region.US_EAST_1, "vpc-123")).thenReturn(resources);
        when(compilerService.compileProgram(new AwsProvider(Region.US_EAST_1), resources)).thenReturn(program);
        when(renderService.render(program)).thenReturn(HCL);

        mockMvc.perform(post("/generate")
                .param("profile", "prod")
                .param("region", "us-east-1")
                .param("vpcId", "vpc-123"))
                .andExpect(status().isOk())
                .andExpect(view().name("index"))
                .andExpect(model().attribute("hcl", HCL))
                .andExpect(model().attribute("html", containsString("<code class=\"language-hcl\">")))
                .andExpect(model().attribute("html", containsString("vpc-123")));
    }

    @Test
    void shouldRejectUnsupportedRegion() throws Exception {
        mockMvc.perform(post("/generate")
                .param("profile", "prod")
                .param("region", "moon-1")
                .param("vpcId", "vpc-123"))
                .andExpect(status().isOk())
                .andExpect(view().name("error"))
                .andExpect(model().attribute("error", "Error generating Terraform: Unsupported region moon-1"));

        verify(awsService, never()).importNetwork(any(), any(), any());
    }

    @Test
    void shouldHandleImportError() throws Exception {
        when(awsService.importNetwork("default", Region.US_EAST_1, "vpc-123"))
                .thenThrow(new RuntimeException("AWS error"));

        mockMvc.perform(post("/generate")
                .param("profile", "default")
                .param("region", "us-east-1")
                .param("vpcId", "vpc-123"))
                .andExpect(status().isOk())
                .andExpect(view().name("error"))
                .andExpect(model().attribute("error", "Error generating Terraform: AWS error"));

        verify(compilerService, never()).compileProgram(eq(new AwsProvider(Region.US_EAST_1)), anyList());
    }
}
