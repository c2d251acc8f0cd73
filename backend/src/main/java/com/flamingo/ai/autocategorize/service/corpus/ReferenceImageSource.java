package com.flamingo.ai.autocategorize.service.corpus;

import com.flamingo.ai.autocategorize.domain.model.ReferenceImage;
import java.util.List;

/** Previously categorised images that carry visual evidence. */
public interface ReferenceImageSource {

  List<ReferenceImage> findReferenceImages();
}
