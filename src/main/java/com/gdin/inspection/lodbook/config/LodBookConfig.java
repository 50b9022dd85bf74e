package com.gdin.inspection.lodbook.config;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.lodbook.codec.JacksonJsonLdCodec;
import com.gdin.inspection.lodbook.codec.LinkedDataCodec;
import com.gdin.inspection.lodbook.config.properties.LodBookProperties;
import com.gdin.inspection.lodbook.index.pipeline.PipelineFactory;
import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.registry.ConfiguredTypeRegistry;
import com.gdin.inspection.lodbook.registry.TypeRegistry;
import com.gdin.inspection.lodbook.repository.InMemoryRecordStore;
import com.gdin.inspection.lodbook.repository.RecordLoader;
import com.gdin.inspection.lodbook.repository.RecordStore;
import com.gdin.inspection.lodbook.state.AdvisoryStore;
import com.gdin.inspection.lodbook.state.InMemoryAdvisoryStore;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

@Slf4j
@Configuration
public class LodBookConfig {
    @Resource
    private LodBookProperties lodBookProperties;

    @Resource
    private ResourceLoader resourceLoader;

    @Bean
    protected PipelineFactory<BuildContext> pipelineFactory() {
        return new PipelineFactory<>();
    }

    @Bean
    protected LinkedDataCodec linkedDataCodec() {
        return new JacksonJsonLdCodec();
    }

    @Bean
    protected AdvisoryStore advisoryStore() {
        return new InMemoryAdvisoryStore();
    }

    @Bean
    protected TypeRegistry typeRegistry() {
        return new ConfiguredTypeRegistry(lodBookProperties.getDataTypes());
    }

    @Bean
    protected RecordLoader.RecordSource recordSource() throws IOException {
        String location = lodBookProperties.getSource().getData();
        if (StrUtil.isBlank(location)) {
            log.warn("未配置 gdin.lodbook.source.data，实体记录为空");
            return new RecordLoader.RecordSource(List.of(), null);
        }
        org.springframework.core.io.Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("实体数据文件不存在: {}，实体记录为空", location);
            return new RecordLoader.RecordSource(List.of(), null);
        }
        try (InputStream is = resource.getInputStream()) {
            return new RecordLoader().load(is);
        }
    }

    @Bean
    protected RecordStore recordStore(RecordLoader.RecordSource recordSource) {
        return new InMemoryRecordStore(recordSource.getRecords());
    }

    @Bean
    protected BuildContext buildContext(RecordStore recordStore,
                                        TypeRegistry typeRegistry,
                                        AdvisoryStore advisoryStore,
                                        RecordLoader.RecordSource recordSource) {
        LodBookProperties.Site site = lodBookProperties.getSite();
        LodBookProperties.Markup markup = lodBookProperties.getMarkup();
        return BuildContext.builder()
                .recordStore(recordStore)
                .typeRegistry(typeRegistry)
                .advisories(advisoryStore)
                .siteUrl(StrUtil.nullToEmpty(site.getUrl()))
                .baseUrl(StrUtil.nullToEmpty(site.getBaseurl()))
                .lodContext(resolveContext(lodBookProperties.getSource().getContext(), recordSource.getContext()))
                .textBlockSelector(markup.getTextBlockSelector())
                .quoteSelector(markup.getQuoteSelector())
                .contextWords(markup.getContextWords() == null ? 5 : markup.getContextWords())
                .build();
    }

    /**
     * 取 @context 的顺序：配置 -> 数据文件自带 -> schema.org
     */
    public static Object resolveContext(String configured, Object fromData) {
        if (StrUtil.isNotBlank(configured)) return configured;
        if (fromData != null) return fromData;
        return BuildContext.DEFAULT_CONTEXT;
    }
}
