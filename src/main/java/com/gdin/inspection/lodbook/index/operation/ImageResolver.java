package com.gdin.inspection.lodbook.index.operation;

import cn.hutool.core.io.file.FileNameUtil;
import com.gdin.inspection.lodbook.models.AdvisoryKind;
import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.PropertyValue;
import com.gdin.inspection.lodbook.models.Record;
import com.gdin.inspection.lodbook.models.ScalarValue;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 将 image 属性解析为可展示的文件名。
 * 值为对象时按 name 找到图片记录再取其 image；值为文件名时检查扩展名。
 */
@Component
public class ImageResolver {

    private static final Set<String> DISPLAYABLE = Set.of("jpg", "jpeg", "png", "gif");
    private static final Set<String> UNSUPPORTED = Set.of("tif", "tiff", "pdf");

    public String imageLink(BuildContext ctx, Object image) {
        if (image == null) return null;
        if (image instanceof Map) {
            return findImageFile(ctx, (Map<?, ?>) image);
        }
        return checkExtension(ctx, String.valueOf(image));
    }

    private String findImageFile(BuildContext ctx, Map<?, ?> image) {
        Object name = image.get("name");
        if (name == null) return null;

        Optional<Record> record = ctx.getRecordStore().findByName(String.valueOf(name));
        PropertyValue file = record.map(r -> r.get("image")).orElse(null);
        if (file instanceof ScalarValue && ((ScalarValue) file).getValue() != null) {
            return ((ScalarValue) file).asString();
        }
        ctx.advise(AdvisoryKind.MISSING_IMAGE_RECORD, String.valueOf(name), "未找到图片记录或记录缺少 image");
        return null;
    }

    private String checkExtension(BuildContext ctx, String image) {
        String extension = FileNameUtil.extName(image);
        if (extension == null) return null;
        extension = extension.toLowerCase(Locale.ROOT);
        if (DISPLAYABLE.contains(extension)) {
            return image;
        }
        if (UNSUPPORTED.contains(extension)) {
            ctx.advise(AdvisoryKind.UNSUPPORTED_IMAGE_FORMAT, image, "图片格式无法展示");
        }
        return null;
    }
}
