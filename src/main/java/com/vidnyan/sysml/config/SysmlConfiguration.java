package com.vidnyan.sysml.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.sysml.ModelProperties;
import com.vidnyan.sysml.domain.build.ModelBuilder;
import com.vidnyan.sysml.domain.build.ModelElementFactory;
import com.vidnyan.sysml.domain.expression.BuiltinFunctionLibrary;
import com.vidnyan.sysml.domain.expression.BuiltinFunctionRegistry;
import com.vidnyan.sysml.domain.expression.ExpressionEvaluator;
import com.vidnyan.sysml.domain.metamodel.ImplicitGeneralizations;
import com.vidnyan.sysml.domain.metamodel.KermlMetamodel;
import com.vidnyan.sysml.domain.metamodel.MetamodelDescription;
import com.vidnyan.sysml.domain.model.ElementIdProvider;
import com.vidnyan.sysml.domain.model.ModelWorkspace;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for the model engine.
 * Wires the framework-free domain components together.
 */
@Slf4j
@Configuration
public class SysmlConfiguration {

    /**
     * ObjectMapper for JSON parsing.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public MetamodelDescription metamodelDescription() {
        MetamodelDescription description = KermlMetamodel.create();
        log.info("Metamodel: {} kinds", description.definitions().size());
        return description;
    }

    @Bean
    public ImplicitGeneralizations implicitGeneralizations(MetamodelDescription description) {
        return new ImplicitGeneralizations(description);
    }

    @Bean
    public ElementIdProvider elementIdProvider() {
        return new ElementIdProvider();
    }

    @Bean
    public ModelWorkspace modelWorkspace() {
        return new ModelWorkspace();
    }

    @Bean
    public ModelElementFactory modelElementFactory(MetamodelDescription description, ElementIdProvider ids) {
        return new ModelElementFactory(description, ids);
    }

    @Bean
    public ModelBuilder modelBuilder(ModelWorkspace workspace, ImplicitGeneralizations implicits,
                                     ModelProperties properties) {
        return new ModelBuilder(workspace, implicits, properties.isTraceLinking());
    }

    @Bean
    public BuiltinFunctionRegistry builtinFunctionRegistry(List<BuiltinFunctionLibrary> libraries) {
        return new BuiltinFunctionRegistry(libraries);
    }

    @Bean
    public ExpressionEvaluator expressionEvaluator(BuiltinFunctionRegistry registry, ModelWorkspace workspace) {
        return new ExpressionEvaluator(registry, workspace::findLibraryElement);
    }

    /**
     * Log available function libraries on startup.
     */
    @Bean
    public String logFunctionLibraries(List<BuiltinFunctionLibrary> libraries) {
        log.info("Registered {} builtin function libraries:", libraries.size());
        libraries.forEach(l -> log.info("  - {} ({} functions)", l.packageName(), l.functions().size()));
        return "function-libraries-logged";
    }
}
