package com.gdin.inspection.lodbook.index.operation;

import com.gdin.inspection.lodbook.models.AdvisoryKind;
import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.EntityPage;
import com.gdin.inspection.lodbook.models.GraphNode;
import com.gdin.inspection.lodbook.models.PropertyValue;
import com.gdin.inspection.lodbook.models.Record;
import com.gdin.inspection.lodbook.models.TypeMapping;
import com.gdin.inspection.lodbook.util.SlugUtil;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 为每条已配置类型的记录准备页面数据。类型未配置的记录不生成页面。
 */
@Component
public class EntityPageBuilder {

    public static final String PAGE_FILE = "index.html";

    private final GraphCompiler graphCompiler;
    private final ImageResolver imageResolver;

    public EntityPageBuilder(GraphCompiler graphCompiler, ImageResolver imageResolver) {
        this.graphCompiler = graphCompiler;
        this.imageResolver = imageResolver;
    }

    public Optional<EntityPage> build(BuildContext ctx, Record record) {
        Optional<TypeMapping> mapping = ctx.getTypeRegistry().lookup(record.getType());
        if (mapping.isEmpty()) {
            ctx.advise(AdvisoryKind.UNCONFIGURED_TYPE, record.getName(), "类型未配置，不生成页面: " + record.getType());
            return Optional.empty();
        }

        String collection = ctx.getTypeRegistry().collection(record.getType());
        GraphNode graph = graphCompiler.hydrate(ctx, record);
        graph.setMainEntityOfPage(ctx.entityUri(collection, record.getName()) + PAGE_FILE);

        PropertyValue image = record.get("image");
        String imageFile = image == null ? null : imageResolver.imageLink(ctx, GraphCompiler.toPlain(image));

        return Optional.of(EntityPage.builder()
                .name(record.getName())
                .collection(collection)
                .template(mapping.get().getTemplate())
                .dir(collection + "/" + SlugUtil.slugify(record.getName()) + "/")
                .graph(graph)
                .imageFile(imageFile)
                .build());
    }
}
