package com.sparrowlogic.infracompiler.controller;

import com.sparrowlogic.infracompiler.compiler.ResourceCompilerService;
import com.sparrowlogic.infracompiler.model.AwsProvider;
import com.sparrowlogic.infracompiler.model.Region;
import com.sparrowlogic.infracompiler.service.AwsInfrastructureService;
import com.sparrowlogic.infracompiler.service.HclRenderService;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;

@Controller
public class TerraformController {

    private static final Logger logger = LoggerFactory.getLogger(TerraformController.class);

    private final AwsInfrastructureService awsService;
    private final ResourceCompilerService compilerService;
    private final HclRenderService renderService;
    private final Parser markdownParser = Parser.builder().build();
    private final HtmlRenderer htmlRenderer = HtmlRenderer.builder().build();

    public TerraformController(AwsInfrastructureService awsService,
                               ResourceCompilerService compilerService,
                               HclRenderService renderService) {
        this.awsService = awsService;
        this.compilerService = compilerService;
        this.renderService = renderService;
    }

    @GetMapping("/")
    public String showForm() {
        return "form";
    }

    @PostMapping("/generate")
    public String generate(@RequestParam(required = false) String profile,
                           @RequestParam String region,
                           @RequestParam String vpcId,
                           Model model) {
        try {
            var awsRegion = Region.fromCode(region)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported region " + region));
            var resources = awsService.importNetwork(profile, awsRegion, vpcId);
            var program = compilerService.compileProgram(new AwsProvider(awsRegion), resources);
            var hcl = renderService.render(program);

            var markdown = "## Terraform for " + vpcId + " (" + awsRegion.code() + ")\n\n"
                + "```hcl\n" + hcl + "```\n";
            model.addAttribute("vpcId", vpcId);
            model.addAttribute("hcl", hcl);
            model.addAttribute("html", htmlRenderer.render(markdownParser.parse(markdown)));

            return "index";
        } catch (Exception e) {
            logger.error("Failed to generate Terraform for VPC {} in {}", vpcId, region, e);
            model.addAttribute("error", "Error generating Terraform: " + e.getMessage());
            return "error";
        }
    }
}
