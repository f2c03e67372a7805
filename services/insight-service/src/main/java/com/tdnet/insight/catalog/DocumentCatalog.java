package com.tdnet.insight.catalog;

import com.tdnet.common.disclosure.Disclosure;
import java.util.List;

/**
 * Where the summary stage finds its documents. Each returned disclosure carries a {@code storagePath}
 * pointing at the PDF: an object key, or a filesystem path when {@link #isLocal()} is true.
 */
public interface DocumentCatalog {

    List<Disclosure> load(List<String> dates);

    boolean isLocal();
}
